package com.nexflow.nexflow_compiler.model.dto;

import com.nexflow.nexflow_compiler.compiler.GeneratedArtifact;

import java.util.List;

public record ConversionResponse(
    String flowName,
    String code,
    int nodeCount,
    boolean hasLoops,
    boolean hasBranches,
    List<String> stateFields,
    List<String> warnings
) {
    public static ConversionResponse from(GeneratedArtifact artifact) {
        return new ConversionResponse(artifact.flowName(), artifact.text(), artifact.nodeCount(),
                artifact.hasLoops(), artifact.hasBranches(), artifact.stateFields(), artifact.warnings());
    }
}
