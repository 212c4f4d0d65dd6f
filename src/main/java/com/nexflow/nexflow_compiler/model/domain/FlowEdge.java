package com.nexflow.nexflow_compiler.model.domain;

/**
 * Directed edge between two nodes. Not unique by endpoints: parallel edges with
 * different routing conditions are legal, so the declaration index is the identity.
 */
public record FlowEdge(int index, String sourceId, String targetId, String condition) {

    public boolean isConditioned() {
        return condition != null && !condition.isBlank();
    }

    /** Identifier used in warnings and error messages, e.g. "router->answer#3". */
    public String ref() {
        return sourceId + "->" + targetId + "#" + index;
    }
}
