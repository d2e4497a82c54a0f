package io.github.nandaindex.interop.runtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * OASF directory record.
 *
 * @param schemaVersion OASF schema version stamped by the directory, {@code null} on exported records
 */
@JsonPropertyOrder({
    "name", "version", "schema_version", "description", "authors", "created_at", "skills", "locators",
    "extensions", "signature"
})
public record OasfRecord(
        String name,
        String version,
        @JsonProperty("schema_version") @JsonInclude(JsonInclude.Include.NON_NULL) String schemaVersion,
        String description,
        List<String> authors,
        @JsonProperty("created_at") String createdAt,
        List<Skill> skills,
        List<Locator> locators,
        List<Extension> extensions,
        JsonNode signature) {

    public OasfRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        description = description == null ? "" : description;
        authors = List.copyOf(Objects.requireNonNull(authors, "authors"));
        skills = List.copyOf(Objects.requireNonNull(skills, "skills"));
        locators = List.copyOf(Objects.requireNonNull(locators, "locators"));
        extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions"));
        signature = Objects.requireNonNull(signature, "signature").deepCopy();
    }

    /**
     * @param id   taxonomy class uid, absent for skills that only carry a name
     * @param name taxonomy-qualified ({@code category/.../leaf}) or raw skill name
     */
    @JsonPropertyOrder({"id", "name"})
    public record Skill(@JsonInclude(JsonInclude.Include.NON_NULL) Integer id, String name) {

        public Skill {
            Objects.requireNonNull(name, "name");
        }

        /** Last segment of a slash namespaced name. */
        public String leafName() {
            int slash = name.lastIndexOf('/');
            return slash >= 0 ? name.substring(slash + 1) : name;
        }
    }

    public record Locator(String type, String url) {

        public Locator {
            type = type == null ? "" : type;
            Objects.requireNonNull(url, "url");
        }
    }

    public record Extension(String name, String version, JsonNode data) {

        public Extension {
            Objects.requireNonNull(name, "name");
            version = version == null ? "" : version;
            data = data == null ? null : data.deepCopy();
        }
    }
}
