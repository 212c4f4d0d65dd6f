package com.nexflow.nexflow_compiler.exception;

import com.nexflow.nexflow_compiler.ConversionStage;

import java.util.List;

/** Malformed or structurally incomplete export. */
public class GraphParseException extends ConversionException {

    public GraphParseException(String message) {
        super(ConversionStage.PARSE, message, List.of());
    }

    public GraphParseException(String message, List<String> offendingIds) {
        super(ConversionStage.PARSE, message, offendingIds);
    }

    public GraphParseException(String message, Throwable cause) {
        super(ConversionStage.PARSE, message, cause);
    }
}
