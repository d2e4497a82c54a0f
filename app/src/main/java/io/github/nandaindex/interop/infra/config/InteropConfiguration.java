package io.github.nandaindex.interop.infra.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolved settings of the translation engine.
 *
 * @param taxonomyDirectory     OASF schema directory holding {@code skill_categories.json} and {@code skills/}
 * @param schemaPath            AgentFacts schema file, {@code null} for the bundled schema
 * @param keywordRulesPath      keyword table override, {@code null} for the bundled table
 * @param placeholderProviderUrl provider URL used when a registry entry names none
 * @param sourceRegistryId      registry id stamped on entries translated from OASF records
 */
public record InteropConfiguration(
        Path taxonomyDirectory,
        Path schemaPath,
        Path keywordRulesPath,
        String placeholderProviderUrl,
        String sourceRegistryId) {

    public static final Path DEFAULT_TAXONOMY_DIRECTORY = Path.of(".oasf-taxonomy", "schema");
    public static final String DEFAULT_PROVIDER_URL = "https://example.com";
    public static final String DEFAULT_REGISTRY_ID = "agntcy";

    public InteropConfiguration {
        Objects.requireNonNull(taxonomyDirectory, "taxonomyDirectory");
        Objects.requireNonNull(placeholderProviderUrl, "placeholderProviderUrl");
        Objects.requireNonNull(sourceRegistryId, "sourceRegistryId");
    }

    public static InteropConfiguration defaults() {
        return new InteropConfiguration(
                DEFAULT_TAXONOMY_DIRECTORY, null, null, DEFAULT_PROVIDER_URL, DEFAULT_REGISTRY_ID);
    }

    public InteropConfiguration withTaxonomyDirectory(Path directory) {
        return new InteropConfiguration(
                directory, schemaPath, keywordRulesPath, placeholderProviderUrl, sourceRegistryId);
    }

    public InteropConfiguration withSchemaPath(Path path) {
        return new InteropConfiguration(
                taxonomyDirectory, path, keywordRulesPath, placeholderProviderUrl, sourceRegistryId);
    }
}
