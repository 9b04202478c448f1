package com.crewmind.core.model;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered set of fields a task's output must contain.
 * An empty schema accepts any output.
 */
public record OutputSchema(List<FieldSpec> fields) implements Serializable {

    public static final OutputSchema EMPTY = new OutputSchema(List.of());

    public OutputSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
        var names = new LinkedHashSet<String>();
        for (var field : fields) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate schema field: " + field.name());
            }
        }
    }

    public static OutputSchema of(FieldSpec... fields) {
        return new OutputSchema(List.of(fields));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public List<String> requiredFieldNames() {
        return fields.stream()
                .filter(FieldSpec::required)
                .map(FieldSpec::name)
                .collect(Collectors.toList());
    }
}
