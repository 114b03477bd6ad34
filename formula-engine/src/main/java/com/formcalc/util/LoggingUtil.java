package com.formcalc.util;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Logging for the formula engine: every class logs through the static methods here,
 * which write to one java.util.logging logger named {@code com.formcalc}.
 * Console output goes to stdout, with SEVERE records also sent to stderr.
 * The first log call before {@link #initialize} sets up INFO console logging.
 */
public class LoggingUtil {

    private static final Logger logger = Logger.getLogger("com.formcalc");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;

    // one line per record, "[LEVEL] message", plus the stack trace if any
    private static final Formatter CONSOLE_FORMAT = new Formatter() {
        @Override
        public String format(LogRecord record) {
            StringBuilder sb = new StringBuilder()
                    .append('[').append(displayName(record.getLevel())).append("] ")
                    .append(formatMessage(record))
                    .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                sb.append(trace);
            }
            return sb.toString();
        }
    };

    private static class ConsoleStreamHandler extends StreamHandler {
        ConsoleStreamHandler(OutputStream out, Level level) {
            super(out, CONSOLE_FORMAT);
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    public static synchronized void initialize(EngineConfig config) {
        initialize(config.getLoggingLevel(),
                config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(),
                config.getLogFileName());
    }

    /**
     * Configure the engine logger once; later calls are ignored.
     */
    public static synchronized void initialize(String levelName, boolean console, boolean file, String fileName) {
        if (initialized) {
            return;
        }
        currentLevel = parseLevel(levelName);

        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);

        if (console) {
            logger.addHandler(new ConsoleStreamHandler(System.out, currentLevel));
            logger.addHandler(new ConsoleStreamHandler(System.err, Level.SEVERE));
        }

        String logFile = null;
        if (file && fileName != null && !fileName.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                logFile = fileName;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Cannot open log file " + fileName + ", file logging disabled", e);
            }
        }
        initialized = true;

        debug("Logging at " + displayName(currentLevel)
                + (console ? " to console" : "")
                + (logFile != null ? " to " + logFile : ""));
    }

    /**
     * Level for a config name: SEVERE, WARNING, INFO, DEBUG or TRACE, case-insensitive.
     * Anything else means INFO.
     */
    static Level parseLevel(String levelName) {
        if (levelName == null) {
            return Level.INFO;
        }
        return switch (levelName.trim().toUpperCase()) {
            case "SEVERE", "ERROR" -> Level.SEVERE;
            case "WARNING", "WARN" -> Level.WARNING;
            case "DEBUG" -> Level.FINE;
            case "TRACE" -> Level.FINEST;
            default -> Level.INFO;
        };
    }

    private static String displayName(Level level) {
        if (level == Level.FINE) return "DEBUG";
        if (level == Level.FINER || level == Level.FINEST) return "TRACE";
        return level.getName();
    }

    public static void debug(String message) {
        log(Level.FINE, message, null);
    }

    public static void info(String message) {
        log(Level.INFO, message, null);
    }

    public static void warn(String message) {
        log(Level.WARNING, message, null);
    }

    public static void warn(String message, Throwable t) {
        log(Level.WARNING, message, t);
    }

    public static void error(String message) {
        log(Level.SEVERE, message, null);
    }

    public static void error(String message, Throwable t) {
        log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    private static void log(Level level, String message, Throwable t) {
        if (!initialized) {
            initialize("INFO", true, false, null);
        }
        if (t == null) {
            logger.log(level, message);
        } else {
            logger.log(level, message, t);
        }
    }
}
