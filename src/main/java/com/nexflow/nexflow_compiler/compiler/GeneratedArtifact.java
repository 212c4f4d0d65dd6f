package com.nexflow.nexflow_compiler.compiler;

import java.util.List;

/**
 * Final program text for one flow, with the facts callers report on and every
 * warning collected along the pipeline (mapping fallbacks, synthesized defaults, repairs).
 */
public record GeneratedArtifact(
    String flowName,
    String text,
    int nodeCount,
    boolean hasLoops,
    boolean hasBranches,
    List<String> stateFields,
    List<String> warnings
) {
    public GeneratedArtifact {
        stateFields = List.copyOf(stateFields);
        warnings = List.copyOf(warnings);
    }
}
