package io.github.nandaindex.interop.runtime.validation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * One schema violation.
 *
 * @param path    keys ({@link String}) and array indices ({@link Integer}) leading to the offending node
 * @param message human readable description
 * @param rule    schema keyword that failed, e.g. {@code required} or {@code minimum}
 * @param value   the offending node, {@code null} when it cannot be resolved
 */
public record ValidationError(List<Object> path, String message, String rule, JsonNode value) {

    public ValidationError {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(rule, "rule");
        path = List.copyOf(path);
    }
}
