package io.github.nandaindex.interop.runtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatch;
import java.util.List;
import java.util.Objects;

/**
 * Agent description in the Nanda index shape ({@code nanda-v1}), used both for registrations synced from other
 * directories and for federated lookups.
 *
 * @param capabilities  flattened capability names; taxonomy skill ids where a skill was matched
 * @param skillMappings taxonomy coordinates of the matched capabilities, in capability order
 */
@JsonPropertyOrder({
    "agent_id", "registry_id", "agent_name", "version", "description", "capabilities", "skill_mappings",
    "agent_url", "api_url", "last_updated", "schema_version", "source_schema", "oasf_schema_version"
})
public record NandaEntry(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("registry_id") String registryId,
        @JsonProperty("agent_name") String agentName,
        String version,
        String description,
        List<String> capabilities,
        @JsonProperty("skill_mappings") List<CapabilityMatch> skillMappings,
        @JsonProperty("agent_url") String agentUrl,
        @JsonProperty("api_url") String apiUrl,
        @JsonProperty("last_updated") String lastUpdated,
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("source_schema") String sourceSchema,
        @JsonProperty("oasf_schema_version") @JsonInclude(JsonInclude.Include.NON_NULL) String oasfSchemaVersion) {

    public static final String SCHEMA_VERSION = "nanda-v1";

    public NandaEntry {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(registryId, "registryId");
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(version, "version");
        description = description == null ? "" : description;
        capabilities = List.copyOf(Objects.requireNonNull(capabilities, "capabilities"));
        skillMappings = List.copyOf(Objects.requireNonNull(skillMappings, "skillMappings"));
        Objects.requireNonNull(sourceSchema, "sourceSchema");
        schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
    }
}
