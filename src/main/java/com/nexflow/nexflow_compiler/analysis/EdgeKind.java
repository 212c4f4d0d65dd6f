package com.nexflow.nexflow_compiler.analysis;

public enum EdgeKind {
    FORWARD,    // unconditional, towards a node not yet on the DFS path
    BRANCH,     // outgoing edge of a routing node, emitted through add_conditional_edges
    LOOP_BACK   // unconditional edge back to a node on the DFS path
}
