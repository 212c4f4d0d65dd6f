package com.nexflow.nexflow_compiler.schema;

import com.nexflow.nexflow_compiler.model.domain.FieldType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared state record of a flow: every field any node or routing condition touches,
 * in first-seen order, with its merged type and the ids of the nodes that contributed it.
 */
public final class StateSchema {

    private final Map<String, FieldType> fields;
    private final Map<String, List<String>> contributors;

    StateSchema(Map<String, FieldType> fields, Map<String, List<String>> contributors) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        contributors.forEach((name, ids) -> copy.put(name, List.copyOf(ids)));
        this.contributors = Collections.unmodifiableMap(copy);
    }

    public Map<String, FieldType> fields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean contains(String field) {
        return fields.containsKey(field);
    }

    public FieldType typeOf(String field) {
        return fields.get(field);
    }

    public List<String> contributors(String field) {
        return contributors.getOrDefault(field, List.of());
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
