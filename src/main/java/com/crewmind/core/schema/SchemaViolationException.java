package com.crewmind.core.schema;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw output did not satisfy an output schema. Lists every violated field.
 */
public class SchemaViolationException extends RuntimeException {

    public record FieldViolation(String field, String problem) {
        @Override
        public String toString() {
            return field + ": " + problem;
        }
    }

    private final List<FieldViolation> violations;

    public SchemaViolationException(List<FieldViolation> violations) {
        super("Output schema violated: " + violations.stream()
                .map(FieldViolation::toString)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    public List<String> getFieldNames() {
        return violations.stream().map(FieldViolation::field).toList();
    }
}
