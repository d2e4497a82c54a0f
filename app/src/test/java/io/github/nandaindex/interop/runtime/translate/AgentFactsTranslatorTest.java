package io.github.nandaindex.interop.runtime.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nandaindex.interop.runtime.TaxonomyFixtures;
import io.github.nandaindex.interop.runtime.model.AgentFactsRecord;
import io.github.nandaindex.interop.runtime.model.RegistryEntry;
import io.github.nandaindex.interop.runtime.validation.SchemaValidator;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgentFactsTranslatorTest {

    private static final SchemaValidator VALIDATOR = SchemaValidator.defaultSchema();

    private final ObjectMapper mapper = new ObjectMapper();
    private final AgentFactsTranslator translator =
            new AgentFactsTranslator(TaxonomyFixtures.matcher(), AgentFactsTranslator.DEFAULT_PROVIDER_URL);

    private JsonNode json(String text) throws IOException {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("agent-123 becomes a valid record carrying its endpoint")
    void sampleAgentShouldTranslateToValidRecord() throws IOException {
        JsonNode agent = json("""
                {"id": "agent-123", "capabilities": ["text", "math"],
                 "endpoints": ["https://api.example.com/v1/invoke"]}
                """);

        AgentFactsRecord record = translator.toAgentFacts(agent);

        assertThat(record.id()).isEqualTo("agent-123");
        assertThat(record.agentName()).isEqualTo("agent-123");
        assertThat(record.label()).isEqualTo("agent-123");
        assertThat(record.version()).isEqualTo("1.0.0");
        assertThat(record.endpoints().staticUrls()).containsExactly("https://api.example.com/v1/invoke");
        assertThat(record.provider()).isEqualTo(new AgentFactsRecord.Provider("agent-123", "https://example.com"));
        assertThat(record.capabilities().modalities()).containsExactly("text", "math");
        assertThat(record.capabilities().authentication().methods()).containsExactly("none");
        assertThat(record.skills())
                .extracting(AgentFactsRecord.Skill::id)
                .containsExactly("text_classification", "skill:math");
        assertThat(record.skills().get(0).description())
                .isEqualTo("Skill mapped from capability 'text' (class: Text Classification)");
        assertThat(record.skills().get(1).description()).isEqualTo("Capability skill for math");
        assertThat(VALIDATOR.validate(record).valid()).isTrue();
    }

    @Test
    void withoutTaxonomyEveryCapabilityGetsItsOwnSkill() throws IOException {
        AgentFactsRecord record = new AgentFactsTranslator().toAgentFacts(json("""
                {"id": "agent-123", "capabilities": ["text", "math"]}
                """));

        assertThat(record.skills())
                .extracting(AgentFactsRecord.Skill::id)
                .containsExactly("skill:text", "skill:math");
        assertThat(VALIDATOR.validate(record).valid()).isTrue();
    }

    @Test
    @DisplayName("Capabilities resolving to the same leaf yield a single skill")
    void duplicateCapabilitiesShouldCollapse() throws IOException {
        AgentFactsRecord record = translator.toAgentFacts(json("""
                {"agent_id": "dup", "capabilities":
                  ["text_classification", "text-classification", "Text Classification"]}
                """));

        assertThat(record.skills()).singleElement()
                .extracting(AgentFactsRecord.Skill::id)
                .isEqualTo("text_classification");
    }

    @Test
    void agentWithoutCapabilitiesGetsPlaceholderSkill() throws IOException {
        AgentFactsRecord record = translator.toAgentFacts(json("""
                {"name": "bare"}
                """));

        assertThat(record.id()).isEqualTo("bare");
        assertThat(record.capabilities().modalities()).containsExactly("text");
        assertThat(record.skills()).singleElement()
                .extracting(AgentFactsRecord.Skill::id)
                .isEqualTo(AgentFactsTranslator.PLACEHOLDER_SKILL_ID);
        assertThat(VALIDATOR.validate(record).valid()).isTrue();
    }

    @Test
    void aliasesAndProviderShapesAreHonoured() throws IOException {
        AgentFactsRecord fromObject = translator.toAgentFacts(json("""
                {"agent_id": "a1", "name": "Agent One", "caption": "Does things", "version": "2.0.0",
                 "provider": {"name": "Labs"}, "endpoint": "https://a1.example.org",
                 "capabilities": [{"name": "summarization"}, {"id": "vision"}, 7]}
                """));

        assertThat(fromObject.id()).isEqualTo("a1");
        assertThat(fromObject.label()).isEqualTo("Agent One");
        assertThat(fromObject.description()).isEqualTo("Does things");
        assertThat(fromObject.version()).isEqualTo("2.0.0");
        assertThat(fromObject.provider()).isEqualTo(new AgentFactsRecord.Provider("Labs", "https://example.com"));
        assertThat(fromObject.endpoints().staticUrls()).containsExactly("https://a1.example.org");
        assertThat(fromObject.skills())
                .extracting(AgentFactsRecord.Skill::id)
                .containsExactly("summarization", "image_classification");

        AgentFactsRecord fromString = translator.toAgentFacts(json("""
                {"id": "a2", "provider": "Example Corp", "provider_url": "https://corp.example.org"}
                """));

        assertThat(fromString.provider())
                .isEqualTo(new AgentFactsRecord.Provider("Example Corp", "https://corp.example.org"));
    }

    @Test
    void missingIdentityShouldBeRejected() throws IOException {
        JsonNode agent = json("""
                {"description": "nobody", "capabilities": ["text"]}
                """);

        assertThatThrownBy(() -> translator.toAgentFacts(agent))
                .isInstanceOf(MissingIdentityException.class)
                .hasMessageContaining("agent_id");
    }

    @Test
    void nonObjectInputShouldBeRejected() throws IOException {
        JsonNode array = json("[1, 2]");

        assertThatThrownBy(() -> translator.toAgentFacts(array))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("array");
        assertThatThrownBy(() -> translator.toAgentFacts(null)).isInstanceOf(MalformedInputException.class);
    }

    @Test
    @DisplayName("Round trip keeps id, capabilities and endpoints but drops the provider")
    void roundTripShouldPreserveCoreFields() throws IOException {
        JsonNode agent = json("""
                {"id": "rt-1", "name": "Round Trip", "description": "d",
                 "provider": {"name": "Labs", "url": "https://labs.example.org"},
                 "capabilities": ["chat", "search"], "endpoints": ["https://one", "https://two"]}
                """);

        RegistryEntry entry = translator.toRegistryEntry(translator.toAgentFacts(agent));

        assertThat(entry.id()).isEqualTo("rt-1");
        assertThat(entry.name()).isEqualTo("Round Trip");
        assertThat(entry.description()).isEqualTo("d");
        assertThat(entry.version()).isEqualTo("1.0.0");
        assertThat(entry.capabilities()).containsExactlyInAnyOrder("chat", "search");
        assertThat(entry.endpoints()).containsExactly("https://one", "https://two");
    }

    @Test
    void blankStringEntriesSurviveRoundTrip() throws IOException {
        JsonNode agent = json("""
                {"id": "a", "capabilities": ["text", ""], "endpoints": ["", "https://a", 42]}
                """);

        AgentFactsRecord record = translator.toAgentFacts(agent);
        RegistryEntry entry = translator.toRegistryEntry(record);

        assertThat(record.skills())
                .extracting(AgentFactsRecord.Skill::id)
                .containsExactly("text_classification");
        assertThat(entry.endpoints()).containsExactly("", "https://a");
        assertThat(entry.capabilities()).containsExactly("text", "");
        assertThat(VALIDATOR.validate(record).valid()).isTrue();
    }

    @Test
    void onlyBlankCapabilitiesStillYieldPlaceholderSkill() throws IOException {
        AgentFactsRecord record = translator.toAgentFacts(json("""
                {"id": "b", "capabilities": ["  "]}
                """));

        assertThat(record.capabilities().modalities()).containsExactly("  ");
        assertThat(record.skills()).singleElement()
                .extracting(AgentFactsRecord.Skill::id)
                .isEqualTo(AgentFactsTranslator.PLACEHOLDER_SKILL_ID);
    }

    @Test
    void rawAgentFactsDocumentShouldConvertLossily() throws IOException {
        JsonNode record = mapper.readTree(TaxonomyFixtures.RECORDS_DIR.resolve("agentfacts.json").toFile());

        RegistryEntry entry = translator.toRegistryEntry(record);

        assertThat(entry).isEqualTo(new RegistryEntry(
                "agent-123",
                "Agent 123",
                "Classifies and answers questions.",
                "1.0.0",
                List.of("text", "math"),
                List.of("https://api.example.com/v1/invoke")));
    }
}
