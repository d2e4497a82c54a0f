package io.github.nandaindex.interop.runtime.taxonomy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Non-fatal problem found while loading a taxonomy catalog.
 */
public record LoadWarning(Kind kind, Path source, String message) {

    public LoadWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + " " + source + ": " + message;
    }

    public enum Kind {
        CATALOG_MISSING,
        CATEGORIES_UNREADABLE,
        SKILL_UNREADABLE,
        SKILL_UNNAMED
    }
}
