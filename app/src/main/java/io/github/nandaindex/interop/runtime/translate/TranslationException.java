package io.github.nandaindex.interop.runtime.translate;

/**
 * Base type of the errors a translator raises. Everything else degrades to documented defaults.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
