package com.nexflow.nexflow_compiler.analysis;

import java.util.List;

/**
 * A node whose outgoing edges are routed conditionally.
 *
 * @param defaultTargetId    target when no route matches; null means the graph's END
 * @param defaultSynthesized true when the flow declared no default and one was added
 */
public record BranchPoint(String sourceId, String routeField, List<BranchRoute> routes,
                          String defaultTargetId, boolean defaultSynthesized) {

    public BranchPoint {
        routes = List.copyOf(routes);
    }

    public boolean defaultsToEnd() {
        return defaultTargetId == null;
    }
}
