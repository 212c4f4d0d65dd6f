package com.nexflow.nexflow_compiler.model.domain;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Semantic type tag of a state field, with its Python annotation.
 */
public enum FieldType {
    TEXT("str"),
    NUMBER("float"),
    BOOLEAN("bool"),
    LIST("List[Any]"),
    LIST_OF_TEXT("List[str]"),
    MAPPING("Dict[str, Any]");

    private final String pythonAnnotation;

    FieldType(String pythonAnnotation) {
        this.pythonAnnotation = pythonAnnotation;
    }

    public String pythonAnnotation() {
        return pythonAnnotation;
    }

    /**
     * Widens two tags to the most general compatible one.
     * Empty when the pair cannot be merged (e.g. a single value against a keyed mapping).
     */
    public Optional<FieldType> mergeWith(FieldType other) {
        if (other == null) return Optional.of(this);
        return join(EnumSet.of(this, other));
    }

    /**
     * Joins every tag a field was given, independent of the order they were seen in.
     * Empty when a mapping meets any other tag, or a number/boolean meets a list.
     */
    public static Optional<FieldType> join(Collection<FieldType> tags) {
        if (tags.isEmpty()) throw new IllegalArgumentException("Nothing to join");
        Set<FieldType> set = EnumSet.copyOf(tags);
        if (set.size() == 1) return Optional.of(set.iterator().next());
        if (set.contains(MAPPING)) return Optional.empty();

        boolean lists = set.contains(LIST) || set.contains(LIST_OF_TEXT);
        boolean numeric = set.contains(NUMBER) || set.contains(BOOLEAN);
        if (lists && numeric) return Optional.empty();
        if (lists) {
            // text next to any list narrows it to list-of-text
            return Optional.of(set.contains(TEXT) || !set.contains(LIST) ? LIST_OF_TEXT : LIST);
        }
        // TEXT absorbs any scalar; NUMBER absorbs BOOLEAN
        return Optional.of(set.contains(TEXT) ? TEXT : NUMBER);
    }

    /** Parses the type names accepted in exports ("str", "int", "dict", ...). Null for unknown names. */
    public static FieldType fromExportName(String name) {
        if (name == null || name.isBlank()) return null;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "text", "str", "string"                 -> TEXT;
            case "number", "int", "float", "integer"     -> NUMBER;
            case "boolean", "bool"                       -> BOOLEAN;
            case "list", "array"                         -> LIST;
            case "list_of_text", "list[str]", "strings"  -> LIST_OF_TEXT;
            case "mapping", "dict", "object", "map"      -> MAPPING;
            default                                      -> null;
        };
    }
}
