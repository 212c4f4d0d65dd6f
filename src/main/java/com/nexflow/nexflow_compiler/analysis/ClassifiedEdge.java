package com.nexflow.nexflow_compiler.analysis;

import com.nexflow.nexflow_compiler.model.domain.FlowEdge;

/**
 * @param closesLoop true for a branch edge that also points back onto the DFS path
 */
public record ClassifiedEdge(FlowEdge edge, EdgeKind kind, boolean closesLoop) {

    public String sourceId() {
        return edge.sourceId();
    }

    public String targetId() {
        return edge.targetId();
    }
}
