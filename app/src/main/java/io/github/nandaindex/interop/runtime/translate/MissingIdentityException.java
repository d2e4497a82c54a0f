package io.github.nandaindex.interop.runtime.translate;

/**
 * The input record has none of the fields an agent identity can be derived from.
 */
public class MissingIdentityException extends TranslationException {

    public MissingIdentityException(String message) {
        super(message);
    }
}
