package com.nexflow.nexflow_compiler.model.domain;

/**
 * A state field a node reads or writes. A null type means the export declared the
 * field without a type; it adopts whatever type the rest of the flow gives it.
 */
public record FieldSpec(String name, FieldType type) {

    public static FieldSpec of(String name, FieldType type) {
        return new FieldSpec(name, type);
    }

    public static FieldSpec untyped(String name) {
        return new FieldSpec(name, null);
    }

    public boolean isTyped() {
        return type != null;
    }
}
