package io.github.nandaindex.interop.runtime.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatch;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatcher;
import io.github.nandaindex.interop.runtime.model.NandaEntry;
import io.github.nandaindex.interop.runtime.model.OasfRecord;
import io.github.nandaindex.interop.runtime.taxonomy.SkillDefinition;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Translates between Nanda registry entries and OASF directory records.
 * <p>
 * Export ({@link #toOasfRecord(JsonNode)}) keeps only capabilities that resolve to a taxonomy skill. Import
 * ({@link #toNandaEntry(OasfRecord)}) classifies locators by type:
 * <ul>
 *   <li>bridge role: type contains {@code bridge}, {@code source}, {@code github} or {@code docker}</li>
 *   <li>api role: type contains {@code api} or {@code service}</li>
 * </ul>
 * Without a bridge locator the first locator is used as agent URL.
 */
public final class OasfTranslator {

    public static final String DEFAULT_REGISTRY_ID = "agntcy";
    public static final String SOURCE_SCHEMA = "oasf";
    public static final String UNKNOWN_SCHEMA_VERSION = "unknown";
    public static final String BRIDGE_LOCATOR = "bridge-url";
    public static final String API_LOCATOR = "api-url";
    public static final String PLACEHOLDER_SCHEME = "placeholder://";
    public static final String RECORD_FILE_SUFFIX = ".record.json";

    static final FieldRule AGENT_IDENTITY = FieldRule.firstOf("agent_id", "agent_id", "id", "name");
    static final FieldRule LAST_UPDATE = FieldRule.firstOf("last_update", "last_update", "last_updated");
    static final FieldRule AGENT_URL = FieldRule.firstOf("agent_url", "agent_url");
    static final FieldRule API_URL = FieldRule.firstOf("api_url", "api_url");

    private static final List<String> BRIDGE_TYPES = List.of("bridge", "source", "github", "docker");
    private static final List<String> API_TYPES = List.of("api", "service");

    private final CapabilityMatcher matcher;
    private final String registryId;
    private final Clock clock;

    public OasfTranslator(CapabilityMatcher matcher) {
        this(matcher, DEFAULT_REGISTRY_ID, Clock.systemUTC());
    }

    public OasfTranslator(CapabilityMatcher matcher, String registryId, Clock clock) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.registryId = Objects.requireNonNull(registryId, "registryId");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Exports a Nanda registry agent as an OASF record.
     *
     * @throws MalformedInputException  if {@code agent} is not a JSON object
     * @throws MissingIdentityException if the agent has no id
     */
    public OasfRecord toOasfRecord(JsonNode agent) {
        JsonInputs.requireObject(agent, "registry agent");
        String agentId = AGENT_IDENTITY.text(agent).orElseThrow(() -> new MissingIdentityException(
                "Registry agent has no usable identity; tried " + String.join(", ", AGENT_IDENTITY.keys())));
        AgentIdentifier identifier = AgentIdentifier.parse(agentId);
        if (identifier.name().isBlank()) {
            throw new MissingIdentityException("Registry agent id '" + agentId + "' has no name part");
        }
        List<String> capabilities = JsonInputs.nonBlank(JsonInputs.capabilityNames(agent.get("capabilities")));
        List<String> tags = JsonInputs.nonBlank(JsonInputs.strings(agent.get("tags")));

        List<OasfRecord.Locator> locators = new ArrayList<>();
        AGENT_URL.text(agent).ifPresent(url -> locators.add(new OasfRecord.Locator(BRIDGE_LOCATOR, url)));
        Optional<String> apiUrl = API_URL.text(agent);
        apiUrl.ifPresent(url -> locators.add(new OasfRecord.Locator(API_LOCATOR, url)));

        List<OasfRecord.Extension> extensions = new ArrayList<>();
        apiUrl.flatMap(RuntimeExtensionCodec::fromCommandUrl).ifPresent(extensions::add);

        return new OasfRecord(
                identifier.name(),
                identifier.version(),
                null,
                describe(agentId, capabilities, tags),
                List.of(),
                LAST_UPDATE.text(agent).orElseGet(this::now),
                exportSkills(capabilities),
                locators,
                extensions,
                JsonNodeFactory.instance.objectNode());
    }

    private List<OasfRecord.Skill> exportSkills(List<String> capabilities) {
        Set<String> seen = new LinkedHashSet<>();
        List<OasfRecord.Skill> skills = new ArrayList<>();
        for (String capability : capabilities) {
            Optional<SkillDefinition> skill = matcher.matchSkill(capability);
            if (skill.isPresent() && seen.add(skill.get().name())) {
                skills.add(new OasfRecord.Skill(skill.get().uid(), matcher.index().qualifiedName(skill.get())));
            }
        }
        return skills;
    }

    static String describe(String agentId, List<String> capabilities, List<String> tags) {
        StringBuilder description = new StringBuilder("Exported agent ")
                .append(agentId)
                .append(" from Nanda registry.");
        List<String> parts = new ArrayList<>();
        if (!capabilities.isEmpty()) {
            parts.add("Capabilities: " + String.join(", ", capabilities));
        }
        if (!tags.isEmpty()) {
            parts.add("Tags: " + String.join(", ", tags));
        }
        if (!parts.isEmpty()) {
            description.append(' ').append(String.join(" | ", parts));
        }
        return description.toString();
    }

    /** File name a directory expects for {@code record}. */
    public static String recordFileName(OasfRecord record) {
        return record.name().replace('/', '-') + RECORD_FILE_SUFFIX;
    }

    /**
     * Reads a raw OASF record leniently: unknown fields are ignored, malformed entries inside lists are dropped.
     *
     * @throws MalformedInputException  if {@code source} is not a JSON object
     * @throws MissingIdentityException if the record has no name
     */
    public OasfRecord readRecord(JsonNode source) {
        JsonInputs.requireObject(source, "OASF record");
        String name = JsonInputs.textOrNull(source, "name");
        if (name == null) {
            throw new MissingIdentityException("OASF record has no name");
        }
        List<OasfRecord.Skill> skills = new ArrayList<>();
        for (JsonNode skill : source.path("skills")) {
            if (skill.isTextual() && !skill.asText().isBlank()) {
                skills.add(new OasfRecord.Skill(null, skill.asText().trim()));
            } else if (skill.isObject() && JsonInputs.textOrNull(skill, "name") != null) {
                JsonNode id = skill.get("id");
                skills.add(new OasfRecord.Skill(
                        id != null && id.canConvertToInt() ? id.asInt() : null,
                        JsonInputs.textOrNull(skill, "name")));
            }
        }
        List<OasfRecord.Locator> locators = new ArrayList<>();
        for (JsonNode locator : source.path("locators")) {
            String url = JsonInputs.textOrNull(locator, "url");
            if (url != null) {
                locators.add(new OasfRecord.Locator(JsonInputs.textOrNull(locator, "type"), url));
            }
        }
        List<OasfRecord.Extension> extensions = new ArrayList<>();
        for (JsonNode extension : source.path("extensions")) {
            String extensionName = JsonInputs.textOrNull(extension, "name");
            if (extensionName != null) {
                extensions.add(new OasfRecord.Extension(
                        extensionName, JsonInputs.textOrNull(extension, "version"), extension.get("data")));
            }
        }
        JsonNode signature = source.get("signature");
        return new OasfRecord(
                name,
                Optional.ofNullable(JsonInputs.textOrNull(source, "version")).orElse(AgentIdentifier.DEFAULT_VERSION),
                JsonInputs.textOrNull(source, "schema_version"),
                Optional.ofNullable(JsonInputs.textOrNull(source, "description")).orElse(""),
                JsonInputs.nonBlank(JsonInputs.strings(source.get("authors"))),
                JsonInputs.textOrNull(source, "created_at"),
                skills,
                locators,
                extensions,
                signature != null && signature.isObject() ? signature : JsonNodeFactory.instance.objectNode());
    }

    public NandaEntry toNandaEntry(JsonNode source) {
        return toNandaEntry(readRecord(source));
    }

    /** Builds the Nanda view of a directory record, resolving its skills against the taxonomy. */
    public NandaEntry toNandaEntry(OasfRecord record) {
        Objects.requireNonNull(record, "record");
        String agentId = new AgentIdentifier(record.name(), record.version()).toAgentId();

        String bridgeUrl = null;
        String apiLocatorUrl = null;
        for (OasfRecord.Locator locator : record.locators()) {
            String type = locator.type().toLowerCase(Locale.ROOT);
            if (bridgeUrl == null && containsAny(type, BRIDGE_TYPES)) {
                bridgeUrl = locator.url();
            } else if (apiLocatorUrl == null && containsAny(type, API_TYPES)) {
                apiLocatorUrl = locator.url();
            }
        }
        if (bridgeUrl == null && !record.locators().isEmpty()) {
            bridgeUrl = record.locators().get(0).url();
        }
        String agentUrl = bridgeUrl != null ? bridgeUrl : PLACEHOLDER_SCHEME + agentId;
        String apiUrl = RuntimeExtensionCodec.toCommandUrl(record.extensions()).orElse(apiLocatorUrl);

        Set<String> seen = new LinkedHashSet<>();
        List<CapabilityMatch> mappings = new ArrayList<>();
        for (OasfRecord.Skill skill : record.skills()) {
            String leafName = skill.leafName();
            Optional<CapabilityMatch> match = matcher.match(leafName);
            if (match.isPresent()) {
                if (seen.add(match.get().skillId())) {
                    mappings.add(match.get());
                }
            } else if (!leafName.isBlank()) {
                seen.add(leafName);
            }
        }

        return new NandaEntry(
                agentId,
                registryId,
                record.name(),
                record.version(),
                record.description(),
                new ArrayList<>(seen),
                mappings,
                agentUrl,
                apiUrl,
                record.createdAt() != null ? record.createdAt() : now(),
                NandaEntry.SCHEMA_VERSION,
                SOURCE_SCHEMA,
                record.schemaVersion() != null ? record.schemaVersion() : UNKNOWN_SCHEMA_VERSION);
    }

    private static boolean containsAny(String value, List<String> needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
