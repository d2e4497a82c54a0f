package io.github.nandaindex.interop.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * Minimal Nanda registry shape recovered from an AgentFacts record. Provider, authentication and per-skill
 * details are not representable here.
 */
public record RegistryEntry(
        String id,
        String name,
        String description,
        String version,
        List<String> capabilities,
        List<String> endpoints) {

    public RegistryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(version, "version");
        capabilities = List.copyOf(Objects.requireNonNull(capabilities, "capabilities"));
        endpoints = List.copyOf(Objects.requireNonNull(endpoints, "endpoints"));
    }
}
