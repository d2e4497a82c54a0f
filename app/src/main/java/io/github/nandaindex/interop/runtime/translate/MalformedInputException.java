package io.github.nandaindex.interop.runtime.translate;

/**
 * The caller handed over text that is not JSON, or JSON whose root is not an object.
 */
public class MalformedInputException extends TranslationException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
