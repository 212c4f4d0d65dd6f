package com.nexflow.nexflow_compiler.exception;

import com.nexflow.nexflow_compiler.ConversionStage;

import java.util.List;

/**
 * Emitted program wires a function or node that is never defined. Points at a
 * generator defect rather than bad input, so it is never auto-repaired.
 */
public class CodeValidationException extends ConversionException {

    public CodeValidationException(String message, List<String> undefinedNames) {
        super(ConversionStage.VALIDATION, message, undefinedNames);
    }
}
