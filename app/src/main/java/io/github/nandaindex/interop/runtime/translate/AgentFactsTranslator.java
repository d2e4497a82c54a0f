package io.github.nandaindex.interop.runtime.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatch;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatcher;
import io.github.nandaindex.interop.runtime.model.AgentFactsRecord;
import io.github.nandaindex.interop.runtime.model.RegistryEntry;
import io.github.nandaindex.interop.runtime.taxonomy.TaxonomyIndex;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts between Nanda registry entries and AgentFacts records.
 * <p>
 * Registry entries come in several loose shapes, so every field is read through a {@link FieldRule}:
 * <ul>
 *   <li>id: {@code id}, {@code agent_id}, {@code name}</li>
 *   <li>label: {@code label}, {@code name}, then the id</li>
 *   <li>description: {@code description}, {@code caption}</li>
 *   <li>endpoints: {@code endpoints}, {@code endpoint}</li>
 * </ul>
 * The reverse direction is lossy: provider, authentication methods and skill details do not survive.
 */
public final class AgentFactsTranslator {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_PROVIDER_URL = "https://example.com";
    public static final String PLACEHOLDER_SKILL_ID = "skill:placeholder";

    static final FieldRule ID = FieldRule.firstOf("id", "id", "agent_id", "name");
    static final FieldRule LABEL = FieldRule.firstOf("label", "label", "name");
    static final FieldRule DESCRIPTION = FieldRule.firstOf("description", "description", "caption");
    static final FieldRule VERSION = FieldRule.firstOf("version", "version");
    static final FieldRule PROVIDER = FieldRule.firstOf("provider", "provider");
    static final FieldRule PROVIDER_URL = FieldRule.firstOf("provider_url", "provider_url");
    static final FieldRule ENDPOINTS = FieldRule.firstOf("endpoints", "endpoints", "endpoint");
    static final FieldRule CAPABILITIES = FieldRule.firstOf("capabilities", "capabilities");

    static final FieldRule RECORD_ID = FieldRule.firstOf("id", "id", "agent_name");
    static final FieldRule RECORD_LABEL = FieldRule.firstOf("label", "label");

    private static final List<String> TEXT_MODE = List.of("text");
    private static final List<String> NO_AUTHENTICATION = List.of("none");

    private final CapabilityMatcher matcher;
    private final String placeholderProviderUrl;

    public AgentFactsTranslator() {
        this(new CapabilityMatcher(TaxonomyIndex.empty()), DEFAULT_PROVIDER_URL);
    }

    public AgentFactsTranslator(CapabilityMatcher matcher, String placeholderProviderUrl) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.placeholderProviderUrl = Objects.requireNonNull(placeholderProviderUrl, "placeholderProviderUrl");
    }

    /**
     * Builds a fresh AgentFacts record from a registry entry.
     *
     * @throws MalformedInputException  if {@code agent} is not a JSON object
     * @throws MissingIdentityException if no id alias is present
     */
    public AgentFactsRecord toAgentFacts(JsonNode agent) {
        JsonInputs.requireObject(agent, "registry entry");
        String id = ID.text(agent).orElseThrow(() -> new MissingIdentityException(
                "Registry entry has no usable identity; tried " + String.join(", ", ID.keys())));
        String label = LABEL.text(agent).orElse(id);
        String description = DESCRIPTION.text(agent).orElse("");
        String version = VERSION.text(agent).orElse(DEFAULT_VERSION);

        List<String> capabilities = JsonInputs.capabilityNames(CAPABILITIES.node(agent).orElse(null));
        List<String> modalities = capabilities.isEmpty() ? TEXT_MODE : capabilities;

        return new AgentFactsRecord(
                id,
                id,
                label,
                description,
                version,
                provider(agent, label),
                new AgentFactsRecord.Endpoints(JsonInputs.strings(ENDPOINTS.node(agent).orElse(null))),
                new AgentFactsRecord.Capabilities(
                        modalities, new AgentFactsRecord.Authentication(NO_AUTHENTICATION)),
                skills(JsonInputs.nonBlank(capabilities)));
    }

    private AgentFactsRecord.Provider provider(JsonNode agent, String label) {
        Optional<JsonNode> provider = PROVIDER.node(agent);
        String fallbackUrl = PROVIDER_URL.text(agent).orElse(placeholderProviderUrl);
        if (provider.isEmpty()) {
            return new AgentFactsRecord.Provider(label, fallbackUrl);
        }
        JsonNode node = provider.get();
        if (node.isObject()) {
            return new AgentFactsRecord.Provider(
                    FieldRule.firstOf("name", "name").text(node).orElse(label),
                    FieldRule.firstOf("url", "url").text(node).orElse(placeholderProviderUrl));
        }
        if (node.isValueNode()) {
            return new AgentFactsRecord.Provider(node.asText().trim(), fallbackUrl);
        }
        return new AgentFactsRecord.Provider(label, fallbackUrl);
    }

    private List<AgentFactsRecord.Skill> skills(List<String> capabilities) {
        if (capabilities.isEmpty()) {
            return List.of(new AgentFactsRecord.Skill(
                    PLACEHOLDER_SKILL_ID, "Placeholder skill", TEXT_MODE, TEXT_MODE, null));
        }
        Map<String, AgentFactsRecord.Skill> byId = new LinkedHashMap<>();
        for (String capability : capabilities) {
            AgentFactsRecord.Skill skill = matcher.match(capability)
                    .map(match -> mappedSkill(capability, match))
                    .orElseGet(() -> new AgentFactsRecord.Skill(
                            "skill:" + capability, "Capability skill for " + capability, TEXT_MODE, TEXT_MODE, null));
            byId.putIfAbsent(skill.id(), skill);
        }
        return new ArrayList<>(byId.values());
    }

    private static AgentFactsRecord.Skill mappedSkill(String capability, CapabilityMatch match) {
        String description = "Skill mapped from capability '" + capability + "' (class: " + match.className() + ")";
        return new AgentFactsRecord.Skill(match.skillId(), description, TEXT_MODE, TEXT_MODE, null);
    }

    public RegistryEntry toRegistryEntry(AgentFactsRecord record) {
        Objects.requireNonNull(record, "record");
        return new RegistryEntry(
                record.id(),
                record.label(),
                record.description(),
                record.version(),
                record.capabilities().modalities(),
                record.endpoints().staticUrls());
    }

    /**
     * Lossy conversion of an AgentFacts document that did not necessarily come from this translator.
     *
     * @throws MalformedInputException  if {@code record} is not a JSON object
     * @throws MissingIdentityException if neither {@code id} nor {@code agent_name} is present
     */
    public RegistryEntry toRegistryEntry(JsonNode record) {
        JsonInputs.requireObject(record, "AgentFacts record");
        String id = RECORD_ID.text(record).orElseThrow(() -> new MissingIdentityException(
                "AgentFacts record has no usable identity; tried " + String.join(", ", RECORD_ID.keys())));
        JsonNode endpoints = record.path("endpoints");
        return new RegistryEntry(
                id,
                RECORD_LABEL.text(record).orElse(id),
                DESCRIPTION.text(record).orElse(""),
                VERSION.text(record).orElse(DEFAULT_VERSION),
                JsonInputs.strings(record.path("capabilities").path("modalities")),
                endpoints.isObject() ? JsonInputs.strings(endpoints.get("static")) : List.of());
    }
}
