package io.github.nandaindex.interop.runtime.matching;

import java.util.Locale;
import java.util.Objects;

/**
 * Heuristic row: a capability containing {@code needle} is mapped to the skill named {@code target}.
 */
public record KeywordRule(String needle, String target) {

    public KeywordRule {
        Objects.requireNonNull(needle, "needle");
        Objects.requireNonNull(target, "target");
        needle = needle.trim().toLowerCase(Locale.ROOT);
        target = target.trim();
        if (needle.isEmpty() || target.isEmpty()) {
            throw new IllegalArgumentException("keyword rule needs a needle and a target");
        }
    }
}
