package io.github.nandaindex.interop.runtime.translate;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared helpers for reading caller supplied JSON.
 */
final class JsonInputs {

    private JsonInputs() {
    }

    static JsonNode requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            String actual = node == null ? "nothing" : node.getNodeType().toString().toLowerCase(Locale.ROOT);
            throw new MalformedInputException(what + " must be a JSON object but was " + actual);
        }
        return node;
    }

    /**
     * String entries of an array, blank ones included; a bare non-blank string counts as a one element list,
     * anything else as empty.
     */
    static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null) {
            return values;
        }
        if (node.isTextual()) {
            if (!node.asText().isBlank()) {
                values.add(node.asText());
            }
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            }
        }
        return values;
    }

    /**
     * Capability names of a registry entry: strings as they are, objects through their {@code name} or
     * {@code id}. Blank strings are kept; other entries are dropped.
     */
    static List<String> capabilityNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        if (node == null) {
            return names;
        }
        if (node.isTextual()) {
            return strings(node);
        }
        if (!node.isArray()) {
            return names;
        }
        FieldRule nameRule = FieldRule.firstOf("capability", "name", "id");
        for (JsonNode item : node) {
            if (item.isTextual()) {
                names.add(item.asText());
            } else if (item.isObject()) {
                nameRule.text(item).ifPresent(names::add);
            }
        }
        return names;
    }

    static List<String> nonBlank(List<String> values) {
        List<String> kept = new ArrayList<>();
        for (String value : values) {
            if (!value.isBlank()) {
                kept.add(value);
            }
        }
        return kept;
    }

    static String textOrNull(JsonNode node, String field) {
        return FieldRule.firstOf(field, field).text(node).orElse(null);
    }
}
