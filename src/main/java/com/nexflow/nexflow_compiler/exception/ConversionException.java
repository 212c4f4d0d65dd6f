package com.nexflow.nexflow_compiler.exception;

import com.nexflow.nexflow_compiler.ConversionStage;
import lombok.Getter;

import java.util.List;

/**
 * Base failure of a flow conversion. Carries the stage that failed and the
 * node/edge ids the failure is about, so callers can point at the offending part.
 */
@Getter
public class ConversionException extends RuntimeException {

    private final ConversionStage stage;
    private final List<String> offendingIds;

    public ConversionException(ConversionStage stage, String message, List<String> offendingIds) {
        super(message);
        this.stage = stage;
        this.offendingIds = offendingIds != null ? List.copyOf(offendingIds) : List.of();
    }

    public ConversionException(ConversionStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.offendingIds = List.of();
    }
}
