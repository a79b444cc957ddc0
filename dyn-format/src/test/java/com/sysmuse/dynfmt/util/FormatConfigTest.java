package com.sysmuse.dynfmt.util;

import com.sysmuse.dynfmt.DynamicFormatter;
import com.sysmuse.dynfmt.UnterminatedPlaceholderMode;
import com.sysmuse.dynfmt.value.TemplateValues;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FormatConfigTest {

    @Test
    public void testDefaults() {
        FormatConfig config = new FormatConfig();
        assertEquals(UnterminatedPlaceholderMode.LITERAL, config.getUnterminatedPlaceholderMode());
        assertEquals("INFO", config.getLoggingLevel());
        assertTrue(config.isConsoleLoggingEnabled());
        assertFalse(config.isFileLoggingEnabled());
        assertEquals("dyn-format.log", config.getLogFileName());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        FormatConfig config = new FormatConfig("src/test/resources/test-format-config.json");
        assertEquals(UnterminatedPlaceholderMode.DROP, config.getUnterminatedPlaceholderMode());
        assertEquals("DEBUG", config.getLoggingLevel());
        assertFalse(config.isConsoleLoggingEnabled());
        assertFalse(config.isFileLoggingEnabled());
        assertEquals("dyn-format-test.log", config.getLogFileName());
        assertNotNull(config.getConfigJson());

        DynamicFormatter formatter = new DynamicFormatter(config);
        assertEquals("1", formatter.format("{}{:3", TemplateValues.list(1)));
    }

    @Test
    public void testMissingFileKeepsDefaults() throws Exception {
        FormatConfig config = new FormatConfig("src/test/resources/no-such-config.json");
        assertEquals(UnterminatedPlaceholderMode.LITERAL, config.getUnterminatedPlaceholderMode());
        assertNull(config.getConfigJson());
    }

    @Test
    public void testInvalidModeKeepsDefault() throws Exception {
        FormatConfig config = new FormatConfig("src/test/resources/test-format-config-invalid.json");
        assertEquals(UnterminatedPlaceholderMode.LITERAL, config.getUnterminatedPlaceholderMode());
    }

    @Test
    public void testFromResource() throws Exception {
        assertEquals(UnterminatedPlaceholderMode.DROP,
                FormatConfig.fromResource("test-format-config.json").getUnterminatedPlaceholderMode());
        assertEquals(UnterminatedPlaceholderMode.LITERAL,
                FormatConfig.fromResource("no-such-config.json").getUnterminatedPlaceholderMode());
    }
}
