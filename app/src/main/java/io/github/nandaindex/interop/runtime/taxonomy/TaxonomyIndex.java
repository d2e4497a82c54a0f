package io.github.nandaindex.interop.runtime.taxonomy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only view of an OASF style skill taxonomy.
 * <p>
 * The index is built once from a catalog by {@link TaxonomyIndexLoader} and never changes afterwards, so a single
 * instance can be shared by any number of translation threads. Leaves and child lists are kept sorted by skill
 * name; every "first" lookup in this package follows that order.
 */
public final class TaxonomyIndex {

    /** Value of {@code extends} that marks a root skill. */
    public static final String ROOT_SENTINEL = "base_skill";

    private final Path catalogRoot;
    private final Map<String, SkillDefinition> skills;
    private final Map<String, List<String>> children;
    private final Map<String, CategoryMeta> categories;
    private final List<SkillDefinition> leaves;

    public TaxonomyIndex() {
        this(Path.of("").toAbsolutePath().normalize(), Map.of(), Map.of());
    }

    public TaxonomyIndex(Path catalogRoot, Map<String, SkillDefinition> skills, Map<String, CategoryMeta> categories) {
        Objects.requireNonNull(catalogRoot, "catalogRoot");
        Objects.requireNonNull(skills, "skills");
        Objects.requireNonNull(categories, "categories");
        this.catalogRoot = catalogRoot.toAbsolutePath().normalize();
        this.skills = Collections.unmodifiableMap(new TreeMap<>(skills));
        this.categories = Collections.unmodifiableMap(new TreeMap<>(categories));
        this.children = buildChildren(this.skills);
        this.leaves = this.skills.values().stream()
                .filter(skill -> !this.children.containsKey(skill.name()))
                .toList();
    }

    public static TaxonomyIndex empty() {
        return new TaxonomyIndex();
    }

    private static Map<String, List<String>> buildChildren(Map<String, SkillDefinition> skills) {
        Map<String, Set<String>> grouped = new TreeMap<>();
        for (SkillDefinition skill : skills.values()) {
            String parent = skill.extendsName();
            if (parent != null && !parent.isBlank()) {
                grouped.computeIfAbsent(parent, ignored -> new TreeSet<>()).add(skill.name());
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        grouped.forEach((parent, names) -> result.put(parent, List.copyOf(names)));
        return Collections.unmodifiableMap(result);
    }

    public Path catalogRoot() {
        return catalogRoot;
    }

    public Map<String, SkillDefinition> skills() {
        return skills;
    }

    public Map<String, CategoryMeta> categories() {
        return categories;
    }

    public int size() {
        return skills.size();
    }

    public boolean isEmpty() {
        return skills.isEmpty();
    }

    public Optional<SkillDefinition> find(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(skills.get(name));
    }

    /** Skills without children, sorted by name. */
    public List<SkillDefinition> leaves() {
        return leaves;
    }

    public boolean isLeaf(String name) {
        return skills.containsKey(name) && !children.containsKey(name);
    }

    /** Names of the skills declaring {@code name} as parent, sorted. */
    public List<String> children(String name) {
        Objects.requireNonNull(name, "name");
        return children.getOrDefault(name, List.of());
    }

    public CategoryMeta category(String key) {
        Objects.requireNonNull(key, "key");
        CategoryMeta meta = categories.get(key);
        return meta != null ? meta : CategoryMeta.empty(key);
    }

    /**
     * Walks the {@code extends} pointers of {@code skill} towards the root.
     * <p>
     * The walk stops at the root sentinel, at a parent that is not loaded, at a skill without {@code extends} and
     * at a name that was already visited. A cut cycle yields the partial chain collected so far. The starting
     * skill counts as visited, so a skill that extends itself has an empty chain.
     */
    public AncestorChain ancestorChain(SkillDefinition skill) {
        Objects.requireNonNull(skill, "skill");
        List<SkillDefinition> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(skill.name());
        SkillDefinition current = skill;
        while (current.extendsName() != null && !current.extendsRoot()) {
            String parentName = current.extendsName();
            if (!seen.add(parentName)) {
                break;
            }
            SkillDefinition parent = skills.get(parentName);
            if (parent == null) {
                break;
            }
            chain.add(parent);
            current = parent;
        }
        Optional<String> categoryKey = Optional.empty();
        if (!chain.isEmpty()) {
            SkillDefinition top = chain.get(chain.size() - 1);
            if (top.extendsRoot()) {
                categoryKey = Optional.of(top.name());
            }
        } else if (skill.extendsRoot()) {
            categoryKey = Optional.of(skill.name());
        }
        return new AncestorChain(chain, categoryKey);
    }

    /** Slash separated path from the root skill down to {@code skill}, e.g. {@code nlp/nlu/text_classification}. */
    public String qualifiedName(SkillDefinition skill) {
        AncestorChain chain = ancestorChain(skill);
        List<String> segments = new ArrayList<>();
        for (int i = chain.ancestors().size() - 1; i >= 0; i--) {
            segments.add(chain.ancestors().get(i).name());
        }
        segments.add(skill.name());
        return String.join("/", segments);
    }
}
