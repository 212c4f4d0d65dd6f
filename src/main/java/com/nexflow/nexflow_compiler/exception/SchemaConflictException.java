package com.nexflow.nexflow_compiler.exception;

import com.nexflow.nexflow_compiler.ConversionStage;
import com.nexflow.nexflow_compiler.model.domain.FieldType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/** Two nodes need the same state field with types that cannot be widened into one. */
@Getter
public class SchemaConflictException extends ConversionException {

    private final String field;
    private final FieldType existingType;
    private final FieldType conflictingType;

    public SchemaConflictException(String field, FieldType existingType, List<String> existingNodeIds,
                                   FieldType conflictingType, String conflictingNodeId) {
        super(ConversionStage.SCHEMA,
                "State field '" + field + "' is " + existingType + " for node(s) " + existingNodeIds
                        + " but " + conflictingType + " for node '" + conflictingNodeId + "'",
                join(existingNodeIds, conflictingNodeId));
        this.field = field;
        this.existingType = existingType;
        this.conflictingType = conflictingType;
    }

    private static List<String> join(List<String> existing, String conflicting) {
        List<String> ids = new ArrayList<>(existing);
        if (!ids.contains(conflicting)) ids.add(conflicting);
        return ids;
    }
}
