package io.github.nandaindex.interop.infra.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves {@link InteropConfiguration} from environment variables, falling back to a {@code .env} file only for
 * keys the environment does not define.
 */
public final class InteropConfigurationLoader {

    static final String ENV_TAXONOMY_DIR = "OASF_SCHEMA_DIR";
    static final String ENV_SCHEMA_PATH = "AGENTFACTS_SCHEMA_PATH";
    static final String ENV_KEYWORDS_PATH = "CAPABILITY_KEYWORDS_PATH";
    static final String ENV_PROVIDER_URL = "AGENTFACTS_PROVIDER_URL";
    static final String ENV_REGISTRY_ID = "OASF_REGISTRY_ID";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public InteropConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    InteropConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public InteropConfiguration load() {
        String taxonomyDir = trimToNull(resolveWithPriority(ENV_TAXONOMY_DIR));
        String schemaPath = trimToNull(resolveWithPriority(ENV_SCHEMA_PATH));
        String keywordsPath = trimToNull(resolveWithPriority(ENV_KEYWORDS_PATH));
        String providerUrl = trimToNull(resolveWithPriority(ENV_PROVIDER_URL));
        String registryId = trimToNull(resolveWithPriority(ENV_REGISTRY_ID));

        return new InteropConfiguration(
                taxonomyDir != null ? Path.of(taxonomyDir) : InteropConfiguration.DEFAULT_TAXONOMY_DIRECTORY,
                schemaPath != null ? Path.of(schemaPath) : null,
                keywordsPath != null ? Path.of(keywordsPath) : null,
                providerUrl != null ? providerUrl : InteropConfiguration.DEFAULT_PROVIDER_URL,
                registryId != null ? registryId : InteropConfiguration.DEFAULT_REGISTRY_ID);
    }

    private String resolveWithPriority(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
