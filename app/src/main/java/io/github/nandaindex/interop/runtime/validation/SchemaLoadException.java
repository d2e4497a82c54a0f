package io.github.nandaindex.interop.runtime.validation;

/**
 * The AgentFacts schema could not be located or parsed. Validation is impossible without it.
 */
public class SchemaLoadException extends RuntimeException {

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
