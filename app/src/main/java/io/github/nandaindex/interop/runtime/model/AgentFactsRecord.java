package io.github.nandaindex.interop.runtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * AgentFacts description of an agent. Every translation produces a fresh instance; nested lists are immutable.
 */
@JsonPropertyOrder({
    "id", "agent_name", "label", "description", "version", "provider", "endpoints", "capabilities", "skills"
})
public record AgentFactsRecord(
        String id,
        @JsonProperty("agent_name") String agentName,
        String label,
        String description,
        String version,
        Provider provider,
        Endpoints endpoints,
        Capabilities capabilities,
        List<Skill> skills) {

    public AgentFactsRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(endpoints, "endpoints");
        Objects.requireNonNull(capabilities, "capabilities");
        skills = List.copyOf(Objects.requireNonNull(skills, "skills"));
    }

    public record Provider(String name, String url) {

        public Provider {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(url, "url");
        }
    }

    public record Endpoints(@JsonProperty("static") List<String> staticUrls) {

        public Endpoints {
            staticUrls = List.copyOf(Objects.requireNonNull(staticUrls, "staticUrls"));
        }
    }

    public record Capabilities(List<String> modalities, Authentication authentication) {

        public Capabilities {
            modalities = List.copyOf(Objects.requireNonNull(modalities, "modalities"));
            Objects.requireNonNull(authentication, "authentication");
        }
    }

    public record Authentication(List<String> methods) {

        public Authentication {
            methods = List.copyOf(Objects.requireNonNull(methods, "methods"));
        }
    }

    @JsonPropertyOrder({"id", "description", "inputModes", "outputModes", "latencyBudgetMs"})
    public record Skill(
            String id,
            String description,
            List<String> inputModes,
            List<String> outputModes,
            @JsonInclude(JsonInclude.Include.NON_NULL) Integer latencyBudgetMs) {

        public Skill {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(description, "description");
            inputModes = List.copyOf(Objects.requireNonNull(inputModes, "inputModes"));
            outputModes = List.copyOf(Objects.requireNonNull(outputModes, "outputModes"));
        }

        public Skill withLatencyBudget(Integer budgetMs) {
            return new Skill(id, description, inputModes, outputModes, budgetMs);
        }
    }
}
