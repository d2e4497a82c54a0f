package io.github.nandaindex.interop.runtime.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates AgentFacts records against a Draft 7 JSON Schema.
 * <p>
 * Instances are immutable and thread safe. Create one per schema and hand it to the translators that need it.
 * A schema that cannot be read is reported as {@link SchemaLoadException} at construction time; records that do
 * not conform are reported as data through {@link ValidationResult}.
 */
public final class SchemaValidator {

    public static final String DEFAULT_SCHEMA_RESOURCE = "schema/agentfacts_schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private static final Comparator<ValidationError> ERROR_ORDER = Comparator
            .comparing(ValidationError::path, SchemaValidator::comparePaths)
            .thenComparing(ValidationError::rule)
            .thenComparing(ValidationError::message);

    private final String source;
    private final JsonSchema schema;
    private final ObjectMapper objectMapper;

    private SchemaValidator(String source, JsonNode schemaNode, ObjectMapper objectMapper) {
        this.source = source;
        this.objectMapper = objectMapper;
        try {
            this.schema = SCHEMA_FACTORY.getSchema(schemaNode);
        } catch (JsonSchemaException ex) {
            throw new SchemaLoadException("Invalid AgentFacts schema " + source + ": " + ex.getMessage(), ex);
        }
    }

    public static SchemaValidator defaultSchema() {
        return fromClasspath(DEFAULT_SCHEMA_RESOURCE);
    }

    public static SchemaValidator fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream stream = SchemaValidator.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                throw new SchemaLoadException("AgentFacts schema not found on classpath: " + resource);
            }
            return new SchemaValidator("classpath:" + resource, mapper.readTree(stream), mapper);
        } catch (IOException ex) {
            throw new SchemaLoadException("Invalid JSON in schema resource " + resource + ": " + ex.getMessage(), ex);
        }
    }

    public static SchemaValidator fromPath(Path schemaPath) {
        Objects.requireNonNull(schemaPath, "schemaPath");
        if (!Files.isRegularFile(schemaPath)) {
            throw new SchemaLoadException("AgentFacts schema not found at " + schemaPath);
        }
        ObjectMapper mapper = new ObjectMapper();
        try {
            return new SchemaValidator(schemaPath.toString(), mapper.readTree(schemaPath.toFile()), mapper);
        } catch (IOException ex) {
            throw new SchemaLoadException("Invalid JSON in schema file " + schemaPath + ": " + ex.getMessage(), ex);
        }
    }

    public String source() {
        return source;
    }

    /** Converts {@code record} with Jackson and validates the resulting tree. */
    public ValidationResult validate(Object record) {
        Objects.requireNonNull(record, "record");
        if (record instanceof JsonNode node) {
            return validate(node);
        }
        return validate((JsonNode) objectMapper.valueToTree(record));
    }

    public ValidationResult validate(JsonNode record) {
        Objects.requireNonNull(record, "record");
        Set<ValidationMessage> messages = schema.validate(record);
        List<ValidationError> errors = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            List<Object> path = toSegments(message.getInstanceLocation());
            errors.add(new ValidationError(path, message.getMessage(), message.getType(), resolve(record, path)));
        }
        errors.sort(ERROR_ORDER);
        return ValidationResult.of(errors);
    }

    private static List<Object> toSegments(JsonNodePath location) {
        List<Object> segments = new ArrayList<>();
        if (location == null) {
            return segments;
        }
        for (int i = 0; i < location.getNameCount(); i++) {
            segments.add(location.getElement(i));
        }
        return segments;
    }

    private static JsonNode resolve(JsonNode root, List<Object> path) {
        JsonNode current = root;
        for (Object segment : path) {
            if (current == null) {
                return null;
            }
            current = segment instanceof Integer index ? current.get(index) : current.get(segment.toString());
        }
        return current;
    }

    static int comparePaths(List<Object> left, List<Object> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int result = compareSegments(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareSegments(Object left, Object right) {
        if (left instanceof Integer l && right instanceof Integer r) {
            return Integer.compare(l, r);
        }
        // indices sort before keys when a path mixes both at the same depth
        if (left instanceof Integer) {
            return -1;
        }
        if (right instanceof Integer) {
            return 1;
        }
        return left.toString().compareTo(right.toString());
    }
}
