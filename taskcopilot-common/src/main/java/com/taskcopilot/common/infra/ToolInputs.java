package com.taskcopilot.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Helpers over tool-call input payloads, which are arbitrary JSON trees.
 */
public final class ToolInputs {

    private ToolInputs() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static ObjectNode empty() {
        return MAPPER.createObjectNode();
    }

    /**
     * Convert a key/value map (nested maps, lists, strings, numbers) into a
     * JSON tree.
     */
    public static JsonNode of(Map<String, ?> values) {
        if (values == null)
            return empty();
        return MAPPER.valueToTree(values);
    }

    /**
     * Detached copy of a tree; {@code null} becomes an empty object.
     */
    public static JsonNode copyOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return empty();
        return node.deepCopy();
    }

    /**
     * Collect every textual value, depth-first, in document order.
     * Numbers, booleans and nulls are skipped.
     */
    public static List<String> extractStrings(JsonNode input) {
        List<String> content = new ArrayList<>();
        collect(input, content);
        return content;
    }

    private static void collect(JsonNode node, List<String> out) {
        if (node == null)
            return;
        if (node.isTextual()) {
            out.add(node.textValue());
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                collect(child, out);
            }
        } else if (node.isObject()) {
            Iterator<JsonNode> values = node.elements();
            while (values.hasNext()) {
                collect(values.next(), out);
            }
        }
    }

    /**
     * Textual values of the top-level fields only.
     */
    public static List<String> topLevelStrings(JsonNode input) {
        List<String> content = new ArrayList<>();
        if (input == null || !input.isObject())
            return content;
        Iterator<JsonNode> values = input.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isTextual()) {
                content.add(value.textValue());
            }
        }
        return content;
    }

    /**
     * File paths named by the conventional keys {@code file_path},
     * {@code path} and {@code files} (array of strings).
     */
    public static List<String> extractFilePaths(JsonNode input) {
        List<String> paths = new ArrayList<>();
        if (input == null || !input.isObject())
            return paths;
        JsonNode filePath = input.get("file_path");
        if (filePath != null && filePath.isTextual()) {
            paths.add(filePath.textValue());
        }
        JsonNode path = input.get("path");
        if (path != null && path.isTextual()) {
            paths.add(path.textValue());
        }
        JsonNode files = input.get("files");
        if (files != null && files.isArray()) {
            for (JsonNode f : files) {
                if (f.isTextual()) {
                    paths.add(f.textValue());
                }
            }
        }
        return paths;
    }

    /**
     * Read an integer field, or return the fallback.
     */
    public static int intField(JsonNode input, String field, int fallback) {
        if (input == null)
            return fallback;
        JsonNode value = input.get(field);
        if (value == null)
            return fallback;
        if (value.canConvertToInt())
            return value.intValue();
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.textValue().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
