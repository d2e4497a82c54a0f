package io.github.nandaindex.interop.runtime.taxonomy;

import java.util.Objects;

/**
 * Top-level grouping of the taxonomy, keyed by the name of a root skill.
 */
public record CategoryMeta(String key, String caption, int uid) {

    public CategoryMeta {
        Objects.requireNonNull(key, "key");
        caption = caption == null || caption.isBlank() ? key : caption;
    }

    public static CategoryMeta empty(String key) {
        return new CategoryMeta(key, key, 0);
    }
}
