package com.sysmuse.dynfmt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.dynfmt.util.LoggingUtil;
import com.sysmuse.dynfmt.value.TemplateValues;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds argument lists, and whole template documents, from JSON.
 *
 * Arguments are a JSON array: {@code [1, 2.5, "text", true, null]}. Numbers keep their
 * integral or fractional kind; nested arrays and objects are rendered as their JSON text.
 * A template document is {@code {"template": "...", "arguments": [...]}}.
 */
public class ArgumentLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static List<TemplateValue> fromJson(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Template arguments must be a JSON array");
        }
        List<TemplateValue> values = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            values.add(TemplateValues.of(parseLiteral(node)));
        }
        return values;
    }

    public static List<TemplateValue> parse(String json) throws IOException {
        return fromJson(MAPPER.readTree(json));
    }

    public static List<TemplateValue> loadFromFile(File file) throws IOException {
        List<TemplateValue> values = fromJson(MAPPER.readTree(file));
        LoggingUtil.debug("Loaded " + values.size() + " template arguments from " + file);
        return values;
    }

    /**
     * Reads {@code {"template": "...", "arguments": [...]}}; missing arguments mean an empty list.
     */
    public static FormatArguments documentFromJson(JsonNode root, DynamicFormatter formatter) {
        if (root == null || !root.isObject() || !root.hasNonNull("template")) {
            throw new IllegalArgumentException("Template document must be a JSON object with a \"template\" field");
        }
        String template = root.get("template").asText();
        List<TemplateValue> arguments = root.has("arguments")
                ? fromJson(root.get("arguments"))
                : List.of();
        return new FormatArguments(template, arguments, formatter);
    }

    public static FormatArguments loadDocument(File file, DynamicFormatter formatter) throws IOException {
        return documentFromJson(MAPPER.readTree(file), formatter);
    }

    private static Object parseLiteral(JsonNode node) {
        if (node.isNull() || node.isMissingNode()) return null;
        if (node.isInt()) return node.intValue();
        if (node.isLong()) return node.longValue();
        if (node.isBigInteger()) return node.bigIntegerValue();
        if (node.isBigDecimal()) return node.decimalValue();
        if (node.isFloatingPointNumber()) return node.doubleValue();
        if (node.isIntegralNumber()) return node.longValue();
        if (node.isBoolean()) return node.booleanValue();
        if (node.isTextual()) return node.textValue();
        return node.toString();
    }
}
