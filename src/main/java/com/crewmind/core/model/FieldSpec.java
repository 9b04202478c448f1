package com.crewmind.core.model;

import java.io.Serializable;

/**
 * One named field of a task's output schema.
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean required,
    String description
) implements Serializable {

    public FieldSpec {
        if (type == null) type = FieldType.STRING;
        if (description == null) description = "";
    }

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, true, "");
    }

    public static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, false, "");
    }
}
