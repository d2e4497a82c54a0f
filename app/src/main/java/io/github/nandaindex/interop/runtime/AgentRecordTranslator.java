package io.github.nandaindex.interop.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nandaindex.interop.infra.config.InteropConfiguration;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatch;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatcher;
import io.github.nandaindex.interop.runtime.matching.KeywordRule;
import io.github.nandaindex.interop.runtime.matching.KeywordRuleLoader;
import io.github.nandaindex.interop.runtime.model.AgentFactsRecord;
import io.github.nandaindex.interop.runtime.model.NandaEntry;
import io.github.nandaindex.interop.runtime.model.OasfRecord;
import io.github.nandaindex.interop.runtime.model.RegistryEntry;
import io.github.nandaindex.interop.runtime.taxonomy.LoadWarning;
import io.github.nandaindex.interop.runtime.taxonomy.TaxonomyIndex;
import io.github.nandaindex.interop.runtime.taxonomy.TaxonomyIndexLoader;
import io.github.nandaindex.interop.runtime.translate.AgentFactsTranslator;
import io.github.nandaindex.interop.runtime.translate.MalformedInputException;
import io.github.nandaindex.interop.runtime.translate.NandaEntryNormalizer;
import io.github.nandaindex.interop.runtime.translate.OasfTranslator;
import io.github.nandaindex.interop.runtime.translate.TranslationResult;
import io.github.nandaindex.interop.runtime.validation.SchemaValidator;
import io.github.nandaindex.interop.runtime.validation.ValidationResult;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point used by registry routes and directory adapters. Holds one taxonomy index, one matcher and one
 * schema validator; all of them are immutable, so a single instance serves concurrent callers.
 */
public final class AgentRecordTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentRecordTranslator.class);

    private final ObjectMapper objectMapper;
    private final CapabilityMatcher matcher;
    private final SchemaValidator validator;
    private final AgentFactsTranslator agentFactsTranslator;
    private final OasfTranslator oasfTranslator;
    private final NandaEntryNormalizer normalizer;
    private final List<LoadWarning> taxonomyWarnings;

    public AgentRecordTranslator(
            CapabilityMatcher matcher,
            SchemaValidator validator,
            String placeholderProviderUrl,
            String sourceRegistryId,
            Clock clock,
            List<LoadWarning> taxonomyWarnings) {
        this.objectMapper = new ObjectMapper();
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.agentFactsTranslator = new AgentFactsTranslator(matcher, placeholderProviderUrl);
        this.oasfTranslator = new OasfTranslator(matcher, sourceRegistryId, clock);
        this.normalizer = new NandaEntryNormalizer();
        this.taxonomyWarnings = List.copyOf(Objects.requireNonNull(taxonomyWarnings, "taxonomyWarnings"));
    }

    /**
     * Loads taxonomy, keyword table and schema as configured. A missing taxonomy only produces warnings; a
     * missing or broken schema raises {@link io.github.nandaindex.interop.runtime.validation.SchemaLoadException}.
     */
    public static AgentRecordTranslator create(InteropConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        LOGGER.debug("Creating translator with {}", configuration);
        TaxonomyIndexLoader.LoadResult loaded = new TaxonomyIndexLoader().load(configuration.taxonomyDirectory());
        List<KeywordRule> rules = configuration.keywordRulesPath() != null
                ? KeywordRuleLoader.load(configuration.keywordRulesPath())
                : KeywordRuleLoader.defaults();
        SchemaValidator validator = configuration.schemaPath() != null
                ? SchemaValidator.fromPath(configuration.schemaPath())
                : SchemaValidator.defaultSchema();
        if (!loaded.warnings().isEmpty()) {
            LOGGER.warn("Taxonomy at {} loaded with {} warning(s)",
                    configuration.taxonomyDirectory(), loaded.warnings().size());
        }
        return new AgentRecordTranslator(
                new CapabilityMatcher(loaded.index(), rules),
                validator,
                configuration.placeholderProviderUrl(),
                configuration.sourceRegistryId(),
                Clock.systemUTC(),
                loaded.warnings());
    }

    public TaxonomyIndex taxonomy() {
        return matcher.index();
    }

    public List<LoadWarning> taxonomyWarnings() {
        return taxonomyWarnings;
    }

    public SchemaValidator validator() {
        return validator;
    }

    public AgentFactsRecord toAgentFacts(JsonNode registryEntry) {
        return agentFactsTranslator.toAgentFacts(registryEntry);
    }

    public AgentFactsRecord toAgentFacts(String registryEntryJson) {
        return toAgentFacts(parse(registryEntryJson, "registry entry"));
    }

    /** Translates and validates in one step; the record is returned even when it does not validate. */
    public TranslationResult translateAndValidate(JsonNode registryEntry) {
        AgentFactsRecord record = toAgentFacts(registryEntry);
        return new TranslationResult(record, validator.validate(record));
    }

    public RegistryEntry toRegistryEntry(AgentFactsRecord record) {
        return agentFactsTranslator.toRegistryEntry(record);
    }

    public RegistryEntry toRegistryEntry(JsonNode record) {
        return agentFactsTranslator.toRegistryEntry(record);
    }

    public OasfRecord toOasfRecord(JsonNode registryAgent) {
        return oasfTranslator.toOasfRecord(registryAgent);
    }

    public OasfRecord toOasfRecord(String registryAgentJson) {
        return toOasfRecord(parse(registryAgentJson, "registry agent"));
    }

    public NandaEntry toNandaEntry(OasfRecord record) {
        return oasfTranslator.toNandaEntry(record);
    }

    public NandaEntry toNandaEntry(JsonNode oasfRecord) {
        return oasfTranslator.toNandaEntry(oasfRecord);
    }

    public NandaEntry toNandaEntry(String oasfRecordJson) {
        return toNandaEntry(parse(oasfRecordJson, "OASF record"));
    }

    public NandaEntry normalizeRegistryEntry(JsonNode registryEntry) {
        return normalizer.normalize(registryEntry);
    }

    public Optional<CapabilityMatch> matchCapability(String capability) {
        return matcher.match(capability);
    }

    public ValidationResult validate(AgentFactsRecord record) {
        return validator.validate(record);
    }

    public ValidationResult validate(JsonNode record) {
        return validator.validate(record);
    }

    private JsonNode parse(String json, String what) {
        Objects.requireNonNull(json, what);
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new MalformedInputException(what + " is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedInputException(what + " must be a JSON object");
        }
        return node;
    }
}
