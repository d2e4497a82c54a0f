package io.github.nandaindex.interop.runtime.translate;

import io.github.nandaindex.interop.runtime.model.AgentFactsRecord;
import io.github.nandaindex.interop.runtime.validation.ValidationResult;
import java.util.Objects;

/** A translated AgentFacts record together with the schema verdict for it. */
public record TranslationResult(AgentFactsRecord record, ValidationResult validation) {

    public TranslationResult {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(validation, "validation");
    }

    public boolean valid() {
        return validation.valid();
    }
}
