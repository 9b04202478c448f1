package com.crewmind.core.model;

/**
 * Value type of a structured output field.
 */
public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    LIST,
    OBJECT
}
