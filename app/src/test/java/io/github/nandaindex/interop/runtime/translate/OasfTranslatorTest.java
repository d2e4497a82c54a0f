package io.github.nandaindex.interop.runtime.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nandaindex.interop.runtime.TaxonomyFixtures;
import io.github.nandaindex.interop.runtime.matching.CapabilityMatch;
import io.github.nandaindex.interop.runtime.model.NandaEntry;
import io.github.nandaindex.interop.runtime.model.OasfRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OasfTranslatorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final OasfTranslator translator = new OasfTranslator(
            TaxonomyFixtures.matcher(), OasfTranslator.DEFAULT_REGISTRY_ID, Clock.fixed(NOW, ZoneOffset.UTC));

    private JsonNode fixture(String relative) throws IOException {
        return mapper.readTree(TaxonomyFixtures.RECORDS_DIR.resolve(Path.of(relative)).toFile());
    }

    @Nested
    class Export {

        @Test
        @DisplayName("Registry agent is exported with qualified skills, locators and an MCP extension")
        void registryAgentShouldBecomeOasfRecord() throws IOException {
            OasfRecord record = translator.toOasfRecord(fixture("registry-agent.json"));

            assertThat(record.name()).isEqualTo("agentm-foo");
            assertThat(record.version()).isEqualTo("v1.2.3");
            assertThat(record.schemaVersion()).isNull();
            assertThat(record.description()).isEqualTo(
                    "Exported agent agentm-foo:v1.2.3 from Nanda registry."
                            + " Capabilities: chat, search, math | Tags: demo, internal");
            assertThat(record.createdAt()).isEqualTo("2025-03-01T12:00:00Z");
            assertThat(record.authors()).isEmpty();
            assertThat(record.signature().isEmpty()).isTrue();
            assertThat(record.skills()).containsExactly(
                    new OasfRecord.Skill(
                            10203, "natural_language_processing/natural_language_generation/dialogue_generation"),
                    new OasfRecord.Skill(601, "retrieval_augmented_generation/information_retrieval_synthesis"));
            assertThat(record.locators()).containsExactly(
                    new OasfRecord.Locator("bridge-url", "https://bridge.example.org/agentm-foo"),
                    new OasfRecord.Locator("api-url", "cmd://npx?args=-y @example/agentm-server --stdio"));
            assertThat(record.extensions()).singleElement().satisfies(extension -> {
                assertThat(extension.name()).isEqualTo(RuntimeExtensionCodec.EXTENSION_NAME);
                assertThat(extension.data().at("/servers/nanda-export/command").asText()).isEqualTo("npx");
            });
            assertThat(OasfTranslator.recordFileName(record)).isEqualTo("agentm-foo.record.json");
        }

        @Test
        void minimalAgentShouldUseDefaults() throws IOException {
            OasfRecord record = translator.toOasfRecord(mapper.readTree("""
                    {"id": "team/helper", "capabilities": ["summarization", "summarization"]}
                    """));

            assertThat(record.name()).isEqualTo("team/helper");
            assertThat(record.version()).isEqualTo("v0");
            assertThat(record.createdAt()).isEqualTo(NOW.toString());
            assertThat(record.description())
                    .isEqualTo("Exported agent team/helper from Nanda registry. Capabilities: summarization, summarization");
            assertThat(record.skills()).singleElement().extracting(OasfRecord.Skill::id).isEqualTo(10202);
            assertThat(record.locators()).isEmpty();
            assertThat(record.extensions()).isEmpty();
            assertThat(OasfTranslator.recordFileName(record)).isEqualTo("team-helper.record.json");
        }

        @Test
        void unmatchedCapabilitiesAreNotExported() throws IOException {
            OasfRecord record = translator.toOasfRecord(mapper.readTree("""
                    {"agent_id": "calc:v1", "capabilities": ["math"], "api_url": "https://calc.example.org"}
                    """));

            assertThat(record.skills()).isEmpty();
            assertThat(record.extensions()).isEmpty();
            assertThat(record.locators()).containsExactly(new OasfRecord.Locator("api-url", "https://calc.example.org"));
        }

        @Test
        void agentWithoutIdentityIsRejected() throws IOException {
            JsonNode nameless = mapper.readTree("""
                    {"capabilities": ["chat"]}
                    """);
            JsonNode onlyVersion = mapper.readTree("""
                    {"agent_id": ":v1"}
                    """);

            assertThatThrownBy(() -> translator.toOasfRecord(nameless)).isInstanceOf(MissingIdentityException.class);
            assertThatThrownBy(() -> translator.toOasfRecord(onlyVersion))
                    .isInstanceOf(MissingIdentityException.class)
                    .hasMessageContaining(":v1");
        }
    }

    @Nested
    class Import {

        @Test
        @DisplayName("Directory record maps locators by role and skills through the taxonomy")
        void directoryRecordShouldBecomeNandaEntry() throws IOException {
            NandaEntry entry = translator.toNandaEntry(fixture("oasf/weather-agent.record.json"));

            assertThat(entry.agentId()).isEqualTo("acme-weather-agent:v1.4.0");
            assertThat(entry.registryId()).isEqualTo("agntcy");
            assertThat(entry.agentName()).isEqualTo("acme/weather-agent");
            assertThat(entry.version()).isEqualTo("v1.4.0");
            assertThat(entry.description()).isEqualTo("Answers weather questions.");
            assertThat(entry.agentUrl()).isEqualTo("ghcr.io/acme/weather-agent:1.4.0");
            assertThat(entry.apiUrl()).isEqualTo("cmd://uvx?args=acme-weather-mcp --port 9000");
            assertThat(entry.capabilities()).containsExactly("dialogue_generation", "forecasting");
            assertThat(entry.skillMappings())
                    .singleElement()
                    .isEqualTo(new CapabilityMatch(
                            "dialogue_generation", "Natural Language Processing", 1, "Dialogue Generation", 10203));
            assertThat(entry.lastUpdated()).isEqualTo("2025-02-10T08:30:00Z");
            assertThat(entry.schemaVersion()).isEqualTo(NandaEntry.SCHEMA_VERSION);
            assertThat(entry.sourceSchema()).isEqualTo("oasf");
            assertThat(entry.oasfSchemaVersion()).isEqualTo("0.5.0");
        }

        @Test
        void sparseRecordShouldFallBackToFirstLocatorAndNow() throws IOException {
            NandaEntry entry = translator.toNandaEntry(fixture("oasf/search-agent.record.json"));

            assertThat(entry.agentId()).isEqualTo("search-agent:v0");
            assertThat(entry.agentUrl()).isEqualTo("https://search.example.org/api");
            assertThat(entry.apiUrl()).isEqualTo("https://search.example.org/api");
            assertThat(entry.capabilities()).containsExactly("information_retrieval_synthesis");
            assertThat(entry.lastUpdated()).isEqualTo(NOW.toString());
            assertThat(entry.oasfSchemaVersion()).isEqualTo(OasfTranslator.UNKNOWN_SCHEMA_VERSION);
        }

        @Test
        void recordWithoutLocatorsGetsPlaceholderUrl() {
            OasfRecord record = new OasfRecord(
                    "lonely", "v2", null, null, List.of(), null,
                    List.of(new OasfRecord.Skill(null, "astrology")), List.of(), List.of(),
                    mapper.createObjectNode());

            NandaEntry entry = translator.toNandaEntry(record);

            assertThat(entry.agentUrl()).isEqualTo("placeholder://lonely:v2");
            assertThat(entry.apiUrl()).isNull();
            assertThat(entry.capabilities()).containsExactly("astrology");
            assertThat(entry.skillMappings()).isEmpty();
        }

        @Test
        void githubLocatorWinsOverEarlierUnrelatedLocator() {
            OasfRecord record = new OasfRecord(
                    "coder", "v1", null, "", List.of(), "2025-01-01T00:00:00Z", List.of(),
                    List.of(
                            new OasfRecord.Locator("helm-chart", "oci://charts/coder"),
                            new OasfRecord.Locator("GitHub-Source", "https://github.com/acme/coder")),
                    List.of(), mapper.createObjectNode());

            NandaEntry entry = translator.toNandaEntry(record);

            assertThat(entry.agentUrl()).isEqualTo("https://github.com/acme/coder");
            assertThat(entry.apiUrl()).isNull();
        }

        @Test
        void sourceRegistryIdIsConfigurable() throws IOException {
            OasfTranslator custom = new OasfTranslator(
                    TaxonomyFixtures.matcher(), "dir-eu", Clock.fixed(NOW, ZoneOffset.UTC));

            assertThat(custom.toNandaEntry(fixture("oasf/search-agent.record.json")).registryId()).isEqualTo("dir-eu");
        }

        @Test
        void recordWithoutNameIsRejected() throws IOException {
            JsonNode nameless = fixture("oasf/nameless.record.json");

            assertThatThrownBy(() -> translator.toNandaEntry(nameless)).isInstanceOf(MissingIdentityException.class);
        }

        @Test
        void readRecordDropsMalformedListEntries() throws IOException {
            OasfRecord record = translator.readRecord(mapper.readTree("""
                    {"name": "messy", "skills": ["summarization", 3, {"id": 5}, {"name": "x/y", "id": 7}],
                     "locators": [{"type": "api"}, {"url": "https://messy.example.org"}],
                     "extensions": [{"version": "v1"}], "signature": "not-an-object"}
                    """));

            assertThat(record.skills()).containsExactly(
                    new OasfRecord.Skill(null, "summarization"), new OasfRecord.Skill(7, "x/y"));
            assertThat(record.locators()).containsExactly(new OasfRecord.Locator("", "https://messy.example.org"));
            assertThat(record.extensions()).isEmpty();
            assertThat(record.signature().isObject()).isTrue();
            assertThat(record.skills().get(1).leafName()).isEqualTo("y");
        }
    }
}
