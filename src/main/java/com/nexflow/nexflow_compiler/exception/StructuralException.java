package com.nexflow.nexflow_compiler.exception;

import com.nexflow.nexflow_compiler.ConversionStage;

import java.util.List;

/** Missing or ambiguous entry, unreachable finish, or a loop without a decidable exit. */
public class StructuralException extends ConversionException {

    public StructuralException(String message, List<String> offendingIds) {
        super(ConversionStage.ANALYSIS, message, offendingIds);
    }
}
