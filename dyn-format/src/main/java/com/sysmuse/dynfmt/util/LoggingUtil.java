package com.sysmuse.dynfmt.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Central logging for the dynamic formatter.
 * Thin static wrapper around java.util.logging so the formatting core never touches handlers directly.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.sysmuse.dynfmt");
    private static volatile boolean initialized = false;
    private static volatile Level currentLevel = Level.INFO;
    private static boolean consoleLogging = false;
    private static boolean fileLogging = false;
    private static String logFileName = FormatConfig.DEFAULT_LOG_FILE;
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    private static class StreamConsoleHandler extends StreamHandler {
        StreamConsoleHandler(java.io.PrintStream stream, Level level) {
            super(stream, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Configure where console log messages go. Takes effect on the next initialize.
     */
    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode;
    }

    /**
     * Initialize logging from the logging section of a format config.
     */
    public static synchronized void initialize(FormatConfig config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    public static synchronized void initialize(String levelStr, boolean consoleEnabled, boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileLogging = true;
                logFileName = fileName;
            } catch (IOException e) {
                logger.severe("Failed to create log file: " + e.getMessage());
                fileLogging = false;
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleLogging +
                ", file=" + (fileLogging ? logFileName : "disabled"));
    }

    /**
     * Drop all handlers so the next call to initialize starts from scratch.
     */
    public static synchronized void reset() {
        clearHandlers();
        initialized = false;
        consoleLogging = false;
        fileLogging = false;
        currentLevel = Level.INFO;
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            default:
                return Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            // closing a console handler would close System.out/err
            if (handler instanceof FileHandler) {
                handler.close();
            } else {
                handler.flush();
            }
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new StreamConsoleHandler(System.out, currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new StreamConsoleHandler(System.err, currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                logger.addHandler(new StreamConsoleHandler(System.out, currentLevel));
                logger.addHandler(new StreamConsoleHandler(System.err, Level.SEVERE));
                break;
        }
        consoleLogging = true;
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void debug(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.FINE, message, t);
    }

    public static void trace(String message) {
        ensureInitialized();
        logger.finest(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        ensureInitialized();
        return logger.isLoggable(Level.FINE);
    }

    public static boolean isTraceEnabled() {
        ensureInitialized();
        return logger.isLoggable(Level.FINEST);
    }

    public static Level getLevel() {
        return currentLevel;
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize(FormatConfig.DEFAULT_LOGGING_LEVEL, true, false, null);
        }
    }
}
