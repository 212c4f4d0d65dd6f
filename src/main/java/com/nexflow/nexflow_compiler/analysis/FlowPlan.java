package com.nexflow.nexflow_compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of flow analysis: where execution starts and ends, the order nodes are emitted in,
 * how every edge is wired, and the branch points and loops found on the way.
 */
public final class FlowPlan {

    private final String entryId;
    private final List<String> finishIds;
    private final List<String> visitOrder;
    private final List<ClassifiedEdge> edges;
    private final List<BranchPoint> branchPoints;
    private final List<LoopInfo> loops;
    private final Map<String, String> functionNames;
    private final List<String> warnings;

    FlowPlan(String entryId, List<String> finishIds, List<String> visitOrder, List<ClassifiedEdge> edges,
             List<BranchPoint> branchPoints, List<LoopInfo> loops, Map<String, String> functionNames,
             List<String> warnings) {
        this.entryId = entryId;
        this.finishIds = List.copyOf(finishIds);
        this.visitOrder = List.copyOf(visitOrder);
        this.edges = List.copyOf(edges);
        this.branchPoints = List.copyOf(branchPoints);
        this.loops = List.copyOf(loops);
        this.functionNames = Collections.unmodifiableMap(new LinkedHashMap<>(functionNames));
        this.warnings = List.copyOf(warnings);
    }

    public String getEntryId() {
        return entryId;
    }

    public List<String> getFinishIds() {
        return finishIds;
    }

    public List<String> getVisitOrder() {
        return visitOrder;
    }

    public List<ClassifiedEdge> getEdges() {
        return edges;
    }

    public List<ClassifiedEdge> edgesOfKind(EdgeKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).toList();
    }

    public List<BranchPoint> getBranchPoints() {
        return branchPoints;
    }

    public Optional<BranchPoint> branchPointOf(String nodeId) {
        return branchPoints.stream().filter(b -> b.sourceId().equals(nodeId)).findFirst();
    }

    public List<LoopInfo> getLoops() {
        return loops;
    }

    public boolean hasLoops() {
        return !loops.isEmpty();
    }

    public boolean hasBranches() {
        return !branchPoints.isEmpty();
    }

    public String functionName(String nodeId) {
        String name = functionNames.get(nodeId);
        if (name == null) {
            throw new IllegalArgumentException("No function name assigned to node " + nodeId);
        }
        return name;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
