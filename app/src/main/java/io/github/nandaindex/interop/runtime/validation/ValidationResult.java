package io.github.nandaindex.interop.runtime.validation;

import java.util.List;
import java.util.Objects;

public record ValidationResult(boolean valid, List<ValidationError> errors) {

    public ValidationResult {
        Objects.requireNonNull(errors, "errors");
        errors = List.copyOf(errors);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("a valid result cannot carry errors");
        }
    }

    public static ValidationResult of(List<ValidationError> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
