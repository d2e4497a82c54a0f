package io.github.nandaindex.interop.runtime.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.nandaindex.interop.runtime.model.NandaEntry;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Brings entries of the local Nanda registry into the same {@link NandaEntry} shape that directory records are
 * translated to, so federated lookups return one shape regardless of where the agent lives.
 */
public final class NandaEntryNormalizer {

    public static final String REGISTRY_ID = "nanda";
    public static final String DEFAULT_VERSION = "v1.0.0";

    static final FieldRule AGENT_ID = FieldRule.firstOf("agent_id", "agent_id", "id");
    static final FieldRule AGENT_NAME = FieldRule.firstOf("agent_name", "agent_id", "agent_name", "id");
    static final FieldRule LAST_UPDATED = FieldRule.firstOf("last_updated", "last_updated", "last_update");

    /**
     * @throws MalformedInputException  if {@code entry} is not a JSON object
     * @throws MissingIdentityException if the entry has neither {@code agent_id} nor {@code id}
     */
    public NandaEntry normalize(JsonNode entry) {
        JsonInputs.requireObject(entry, "registry entry");
        String agentId = AGENT_ID.text(entry).orElseThrow(() -> new MissingIdentityException(
                "Registry entry has no usable identity; tried " + String.join(", ", AGENT_ID.keys())));
        List<String> names = JsonInputs.nonBlank(JsonInputs.capabilityNames(entry.get("capabilities")));
        List<String> capabilities = List.copyOf(new LinkedHashSet<>(names));
        return new NandaEntry(
                agentId,
                REGISTRY_ID,
                AGENT_NAME.text(entry).orElse(agentId),
                orDefault(entry, "version", DEFAULT_VERSION),
                orDefault(entry, "description", ""),
                capabilities,
                List.of(),
                orDefault(entry, "agent_url", ""),
                orDefault(entry, "api_url", ""),
                LAST_UPDATED.text(entry).orElse(""),
                NandaEntry.SCHEMA_VERSION,
                REGISTRY_ID,
                null);
    }

    private static String orDefault(JsonNode entry, String field, String fallback) {
        String value = JsonInputs.textOrNull(entry, field);
        return value != null ? value : fallback;
    }
}
