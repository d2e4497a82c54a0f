package io.github.nandaindex.interop.runtime.taxonomy;

import java.util.Objects;

/**
 * One node of the skill taxonomy as declared by a single skill file.
 *
 * @param name        stable identifier, unique within an index
 * @param caption     human readable label
 * @param uid         numeric class code, {@code 0} when the file omits it
 * @param extendsName parent skill name, the {@link TaxonomyIndex#ROOT_SENTINEL} or {@code null}
 */
public record SkillDefinition(String name, String caption, int uid, String extendsName) {

    public SkillDefinition {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        caption = caption == null || caption.isBlank() ? name : caption;
    }

    public boolean extendsRoot() {
        return TaxonomyIndex.ROOT_SENTINEL.equals(extendsName);
    }
}
