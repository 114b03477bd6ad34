package com.formcalc.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigTest {

    @Test
    public void testDefaults() {
        EngineConfig config = new EngineConfig();
        assertEquals("INFO", config.getLoggingLevel());
        assertTrue(config.isConsoleLoggingEnabled());
        assertFalse(config.isFileLoggingEnabled());
        assertEquals(0, config.getFieldBudgetMillis());
        assertTrue(config.isCacheFormulas());
        assertEquals(1024, config.getCacheSize());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        File file = new File(getClass().getClassLoader().getResource("test_engine_config.json").toURI());
        EngineConfig config = new EngineConfig(file.getPath());
        assertEquals("DEBUG", config.getLoggingLevel());
        assertFalse(config.isConsoleLoggingEnabled());
        assertEquals("formcalc.log", config.getLogFileName());
        assertEquals(250, config.getFieldBudgetMillis());
        assertFalse(config.isCacheFormulas());
        assertEquals(64, config.getCacheSize());
    }

    @Test
    public void testBundledDefaultResource() throws Exception {
        EngineConfig config = EngineConfig.loadDefault();
        assertEquals("INFO", config.getLoggingLevel());
        assertTrue(config.isCacheFormulas());
    }

    @Test
    public void testMissingFile() {
        IOException e = assertThrows(IOException.class, () -> new EngineConfig("no/such/config.json"));
        assertTrue(e.getMessage().contains("no/such/config.json"));
    }

    @Test
    public void testInvalidContent() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        EngineConfig config = new EngineConfig();
        assertThrows(IllegalArgumentException.class, () -> config.apply(mapper.readTree("[1, 2]")));
        assertThrows(IllegalArgumentException.class,
                () -> config.apply(mapper.readTree("{\"evaluation\": {\"fieldBudgetMillis\": -5}}")));
        assertThrows(IllegalArgumentException.class,
                () -> config.apply(mapper.readTree("{\"evaluation\": {\"cacheSize\": 0}}")));
    }

    @Test
    public void testLogLevelNames() {
        assertEquals(Level.FINE, LoggingUtil.parseLevel("debug"));
        assertEquals(Level.FINEST, LoggingUtil.parseLevel("TRACE"));
        assertEquals(Level.WARNING, LoggingUtil.parseLevel("warning"));
        assertEquals(Level.INFO, LoggingUtil.parseLevel(null));
        assertEquals(Level.INFO, LoggingUtil.parseLevel("verbose"));
    }
}
