package io.github.nandaindex.interop.runtime.taxonomy;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of walking {@code extends} pointers upward from a skill.
 *
 * @param ancestors   visited parents, nearest first; may be partial when a parent is missing or a cycle was cut
 * @param categoryKey name of the root skill the chain terminated at, if it reached the root sentinel
 */
public record AncestorChain(List<SkillDefinition> ancestors, Optional<String> categoryKey) {

    public AncestorChain {
        Objects.requireNonNull(ancestors, "ancestors");
        Objects.requireNonNull(categoryKey, "categoryKey");
        ancestors = List.copyOf(ancestors);
    }

    public boolean isEmpty() {
        return ancestors.isEmpty();
    }
}
