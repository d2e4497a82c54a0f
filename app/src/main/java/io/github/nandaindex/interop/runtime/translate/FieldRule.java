package io.github.nandaindex.interop.runtime.translate;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered alias list for one logical field of a loosely structured record. The first key holding a present value
 * wins; {@code null}, blank strings and empty containers are not present.
 */
public record FieldRule(String field, List<String> keys) {

    public FieldRule {
        Objects.requireNonNull(field, "field");
        keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("field rule '" + field + "' needs at least one key");
        }
    }

    public static FieldRule firstOf(String field, String... keys) {
        return new FieldRule(field, List.of(keys));
    }

    public Optional<JsonNode> node(JsonNode source) {
        if (source == null || !source.isObject()) {
            return Optional.empty();
        }
        for (String key : keys) {
            JsonNode value = source.get(key);
            if (isPresent(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** First present scalar rendered as trimmed text. Objects and arrays under an alias are skipped. */
    public Optional<String> text(JsonNode source) {
        if (source == null || !source.isObject()) {
            return Optional.empty();
        }
        for (String key : keys) {
            JsonNode value = source.get(key);
            if (isPresent(value) && value.isValueNode()) {
                return Optional.of(value.asText().trim());
            }
        }
        return Optional.empty();
    }

    static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isBlank();
        }
        if (value.isContainerNode()) {
            return !value.isEmpty();
        }
        return true;
    }
}
