package io.github.nandaindex.interop.runtime.matching;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Taxonomy coordinates resolved for one capability string.
 *
 * @param skillId      name of the matched taxonomy skill
 * @param categoryName caption of the top-level category, or its key when the catalog has no caption for it
 * @param categoryUid  uid of the top-level category, {@code 0} when unknown
 * @param className    caption of the matched skill
 * @param classUid     uid of the matched skill
 */
public record CapabilityMatch(
        @JsonProperty("skill_id") String skillId,
        @JsonProperty("category_name") String categoryName,
        @JsonProperty("category_uid") int categoryUid,
        @JsonProperty("class_name") String className,
        @JsonProperty("class_uid") int classUid) {

    public CapabilityMatch {
        Objects.requireNonNull(skillId, "skillId");
        Objects.requireNonNull(className, "className");
    }
}
