package io.github.nandaindex.interop.runtime.matching;

import io.github.nandaindex.interop.runtime.taxonomy.AncestorChain;
import io.github.nandaindex.interop.runtime.taxonomy.CategoryMeta;
import io.github.nandaindex.interop.runtime.taxonomy.SkillDefinition;
import io.github.nandaindex.interop.runtime.taxonomy.TaxonomyIndex;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves free-text capabilities against a {@link TaxonomyIndex}.
 * <p>
 * Tiers, first hit wins:
 * <ol>
 *   <li>the normalised text equals a leaf skill name</li>
 *   <li>the normalised text is contained in a leaf caption (leaves scanned in name order)</li>
 *   <li>the first keyword rule whose needle occurs in the text and whose target exists; a target with children is
 *       replaced by its first child in name order</li>
 * </ol>
 * The matcher only reads the index and is safe to share between threads.
 */
public final class CapabilityMatcher {

    private final TaxonomyIndex index;
    private final List<KeywordRule> keywordRules;

    public CapabilityMatcher(TaxonomyIndex index) {
        this(index, KeywordRuleLoader.defaults());
    }

    public CapabilityMatcher(TaxonomyIndex index, List<KeywordRule> keywordRules) {
        this.index = Objects.requireNonNull(index, "index");
        this.keywordRules = List.copyOf(Objects.requireNonNull(keywordRules, "keywordRules"));
    }

    public TaxonomyIndex index() {
        return index;
    }

    /** Lower-cases the text and turns spaces and hyphens into underscores. */
    public static String normalize(String capability) {
        Objects.requireNonNull(capability, "capability");
        return capability.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    public Optional<CapabilityMatch> match(String capability) {
        return matchSkill(capability).map(this::toMatch);
    }

    /** Same tiers as {@link #match(String)} but returns the taxonomy node itself. */
    public Optional<SkillDefinition> matchSkill(String capability) {
        if (capability == null) {
            return Optional.empty();
        }
        String normalized = normalize(capability);
        // an empty needle would be a substring of every caption
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        if (index.isLeaf(normalized)) {
            return index.find(normalized);
        }
        for (SkillDefinition leaf : index.leaves()) {
            if (leaf.caption().toLowerCase(Locale.ROOT).contains(normalized)) {
                return Optional.of(leaf);
            }
        }
        for (KeywordRule rule : keywordRules) {
            if (!normalized.contains(rule.needle())) {
                continue;
            }
            Optional<SkillDefinition> target = index.find(rule.target());
            if (target.isEmpty()) {
                continue;
            }
            List<String> children = index.children(rule.target());
            if (!children.isEmpty()) {
                return index.find(children.get(0)).or(() -> target);
            }
            return target;
        }
        return Optional.empty();
    }

    public CapabilityMatch toMatch(SkillDefinition skill) {
        AncestorChain chain = index.ancestorChain(skill);
        Optional<CategoryMeta> category = chain.categoryKey().map(index::category);
        return new CapabilityMatch(
                skill.name(),
                category.map(CategoryMeta::caption).orElse(null),
                category.map(CategoryMeta::uid).orElse(0),
                skill.caption(),
                skill.uid());
    }
}
