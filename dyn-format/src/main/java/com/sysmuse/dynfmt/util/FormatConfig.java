package com.sysmuse.dynfmt.util;

import java.io.*;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.dynfmt.UnterminatedPlaceholderMode;

/**
 * FormatConfig - loads and holds formatter configuration from a JSON file.
 *
 * <pre>
 * {
 *   "placeholders": { "unterminated": "LITERAL" },
 *   "logging": { "level": "INFO", "console": true, "file": false, "fileName": "dyn-format.log" }
 * }
 * </pre>
 */
public class FormatConfig {

    public static final String DEFAULT_LOGGING_LEVEL = "INFO";
    public static final String DEFAULT_LOG_FILE = "dyn-format.log";

    // Placeholder handling
    private UnterminatedPlaceholderMode unterminatedPlaceholderMode = UnterminatedPlaceholderMode.LITERAL;

    // Logging configuration
    private String loggingLevel = DEFAULT_LOGGING_LEVEL;
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = DEFAULT_LOG_FILE;

    // Raw JSON config
    private JsonNode configJson;

    /**
     * Default constructor, all defaults
     */
    public FormatConfig() {
    }

    /**
     * Constructor that loads from file
     */
    public FormatConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Load configuration from a classpath resource, falling back to defaults when it is absent.
     */
    public static FormatConfig fromResource(String resourceName) throws IOException {
        FormatConfig config = new FormatConfig();
        try (InputStream in = FormatConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                LoggingUtil.warn("Format config resource not found: " + resourceName);
                return config;
            }
            config.loadFromJson(new ObjectMapper().readTree(in));
        }
        return config;
    }

    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Format config file not found: " + configFilePath);
            LoggingUtil.info("Using default format configuration");
            return;
        }

        ObjectMapper mapper = new ObjectMapper();
        loadFromJson(mapper.readTree(configFile));
    }

    public void loadFromJson(JsonNode root) {
        configJson = root;
        if (root == null || !root.isObject()) {
            LoggingUtil.warn("Format config is not a JSON object, keeping defaults");
            return;
        }

        if (root.has("placeholders")) {
            JsonNode placeholdersNode = root.get("placeholders");

            if (placeholdersNode.has("unterminated")) {
                String modeString = placeholdersNode.get("unterminated").asText().trim().toUpperCase(Locale.ROOT);
                try {
                    unterminatedPlaceholderMode = UnterminatedPlaceholderMode.valueOf(modeString);
                } catch (IllegalArgumentException e) {
                    LoggingUtil.warn("Invalid unterminated placeholder mode: " + modeString +
                            ", using " + unterminatedPlaceholderMode);
                }
            }
        }

        if (root.has("logging")) {
            JsonNode loggingNode = root.get("logging");

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
    }

    public UnterminatedPlaceholderMode getUnterminatedPlaceholderMode() {
        return unterminatedPlaceholderMode;
    }

    public void setUnterminatedPlaceholderMode(UnterminatedPlaceholderMode mode) {
        this.unterminatedPlaceholderMode = mode;
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

    public JsonNode getConfigJson() {
        return configJson;
    }
}
