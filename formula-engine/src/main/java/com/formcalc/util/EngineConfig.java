package com.formcalc.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * EngineConfig - loads and holds the formula engine configuration from a JSON file.
 *
 * <pre>
 * {
 *   "logging":    { "level": "DEBUG", "console": true, "file": false, "fileName": "formcalc.log" },
 *   "evaluation": { "fieldBudgetMillis": 1000, "cacheFormulas": true, "cacheSize": 1024 }
 * }
 * </pre>
 * Missing sections keep their defaults; unknown properties are ignored.
 */
public class EngineConfig {

    public static final String DEFAULT_RESOURCE = "formcalc.json";

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = "formcalc.log";

    // Evaluation configuration, 0 disables the per-field budget check
    private long fieldBudgetMillis = 0;
    private boolean cacheFormulas = true;
    private int cacheSize = 1024;

    public EngineConfig() {
    }

    public EngineConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Load the bundled default configuration, falling back to built-in defaults
     * when the resource is not on the classpath.
     */
    public static EngineConfig loadDefault() throws IOException {
        EngineConfig config = new EngineConfig();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                config.apply(new ObjectMapper().readTree(in));
            }
        }
        return config;
    }

    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            throw new IOException("Engine config file not found: " + configFilePath);
        }

        ObjectMapper mapper = new ObjectMapper();
        apply(mapper.readTree(configFile));
    }

    void apply(JsonNode configJson) {
        if (configJson == null || !configJson.isObject()) {
            throw new IllegalArgumentException("Engine config must be a JSON object");
        }

        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");
            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }
            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }
            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }
            if (loggingNode.has("fileName")) {
                logFileName = loggingNode.get("fileName").asText();
            }
        }

        if (configJson.has("evaluation")) {
            JsonNode evaluationNode = configJson.get("evaluation");
            if (evaluationNode.has("fieldBudgetMillis")) {
                fieldBudgetMillis = evaluationNode.get("fieldBudgetMillis").asLong();
                if (fieldBudgetMillis < 0) {
                    throw new IllegalArgumentException("fieldBudgetMillis must not be negative: " + fieldBudgetMillis);
                }
            }
            if (evaluationNode.has("cacheFormulas")) {
                cacheFormulas = evaluationNode.get("cacheFormulas").asBoolean();
            }
            if (evaluationNode.has("cacheSize")) {
                cacheSize = evaluationNode.get("cacheSize").asInt();
                if (cacheSize < 1) {
                    throw new IllegalArgumentException("cacheSize must be positive: " + cacheSize);
                }
            }
        }
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    public long getFieldBudgetMillis() {
        return fieldBudgetMillis;
    }

    public void setFieldBudgetMillis(long fieldBudgetMillis) {
        this.fieldBudgetMillis = fieldBudgetMillis;
    }

    public boolean isCacheFormulas() {
        return cacheFormulas;
    }

    public void setCacheFormulas(boolean cacheFormulas) {
        this.cacheFormulas = cacheFormulas;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
    }
}
