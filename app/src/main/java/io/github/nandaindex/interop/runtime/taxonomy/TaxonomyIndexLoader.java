package io.github.nandaindex.interop.runtime.taxonomy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads an OASF skill catalog from the file system.
 * <p>
 * Expected layout below the catalog root:
 * <pre>
 * skill_categories.json          {"attributes": {"&lt;key&gt;": {"caption": ..., "uid": ...}}}
 * skills/&lt;category&gt;/**&#47;*.json   {"name": ..., "caption": ..., "uid": ..., "extends": ...}
 * </pre>
 * Loading never fails: a missing catalog yields an empty index and broken files are skipped. Every problem is
 * reported in {@link LoadResult#warnings()}.
 */
public final class TaxonomyIndexLoader {

    static final String CATEGORIES_FILE = "skill_categories.json";
    static final String SKILLS_DIRECTORY = "skills";

    private static final Logger LOGGER = LoggerFactory.getLogger(TaxonomyIndexLoader.class);

    private final ObjectMapper objectMapper;

    public TaxonomyIndexLoader() {
        this(new ObjectMapper());
    }

    public TaxonomyIndexLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public LoadResult load(Path catalogRoot) {
        Objects.requireNonNull(catalogRoot, "catalogRoot");
        List<LoadWarning> warnings = new ArrayList<>();
        if (!Files.isDirectory(catalogRoot)) {
            warn(warnings, LoadWarning.Kind.CATALOG_MISSING, catalogRoot, "taxonomy catalog not found");
            return new LoadResult(new TaxonomyIndex(catalogRoot, Map.of(), Map.of()), warnings);
        }

        Map<String, CategoryMeta> categories = loadCategories(catalogRoot.resolve(CATEGORIES_FILE), warnings);
        Map<String, SkillDefinition> skills = loadSkills(catalogRoot.resolve(SKILLS_DIRECTORY), warnings);
        TaxonomyIndex index = new TaxonomyIndex(catalogRoot, skills, categories);
        LOGGER.info(
                "Loaded taxonomy from {}: {} skills, {} leaves, {} categories, {} warnings",
                catalogRoot,
                index.size(),
                index.leaves().size(),
                index.categories().size(),
                warnings.size());
        return new LoadResult(index, warnings);
    }

    private Map<String, CategoryMeta> loadCategories(Path categoriesFile, List<LoadWarning> warnings) {
        Map<String, CategoryMeta> categories = new HashMap<>();
        if (!Files.isRegularFile(categoriesFile)) {
            return categories;
        }
        try {
            JsonNode attributes = objectMapper.readTree(categoriesFile.toFile()).path("attributes");
            Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode value = entry.getValue();
                categories.put(
                        entry.getKey(),
                        new CategoryMeta(entry.getKey(), textOrNull(value, "caption"), value.path("uid").asInt(0)));
            }
        } catch (IOException e) {
            warn(warnings, LoadWarning.Kind.CATEGORIES_UNREADABLE, categoriesFile, describe(e));
        }
        return categories;
    }

    private Map<String, SkillDefinition> loadSkills(Path skillsDirectory, List<LoadWarning> warnings) {
        Map<String, SkillDefinition> skills = new HashMap<>();
        if (!Files.isDirectory(skillsDirectory)) {
            return skills;
        }
        List<Path> skillFiles;
        try (Stream<Path> stream = Files.walk(skillsDirectory)) {
            skillFiles = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            warn(warnings, LoadWarning.Kind.SKILL_UNREADABLE, skillsDirectory, describe(e));
            return skills;
        }
        for (Path skillFile : skillFiles) {
            parseSkillFile(skillFile, warnings).ifPresent(skill -> skills.put(skill.name(), skill));
        }
        return skills;
    }

    private Optional<SkillDefinition> parseSkillFile(Path skillFile, List<LoadWarning> warnings) {
        JsonNode node;
        try {
            node = objectMapper.readTree(skillFile.toFile());
        } catch (IOException e) {
            warn(warnings, LoadWarning.Kind.SKILL_UNREADABLE, skillFile, describe(e));
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            warn(warnings, LoadWarning.Kind.SKILL_UNREADABLE, skillFile, "skill file is not a JSON object");
            return Optional.empty();
        }
        String name = textOrNull(node, "name");
        if (name == null) {
            warn(warnings, LoadWarning.Kind.SKILL_UNNAMED, skillFile, "skill file has no name");
            return Optional.empty();
        }
        return Optional.of(new SkillDefinition(
                name, textOrNull(node, "caption"), node.path("uid").asInt(0), textOrNull(node, "extends")));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String describe(IOException e) {
        if (e instanceof JsonProcessingException processing) {
            return "invalid JSON: " + processing.getOriginalMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static void warn(List<LoadWarning> warnings, LoadWarning.Kind kind, Path source, String message) {
        LoadWarning warning = new LoadWarning(kind, source, message);
        LOGGER.warn("Taxonomy load warning: {}", warning);
        warnings.add(warning);
    }

    public record LoadResult(TaxonomyIndex index, List<LoadWarning> warnings) {

        public LoadResult {
            Objects.requireNonNull(index, "index");
            warnings = List.copyOf(warnings);
        }
    }
}
