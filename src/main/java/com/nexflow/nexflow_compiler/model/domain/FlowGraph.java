package com.nexflow.nexflow_compiler.model.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Parsed flow: nodes and edges in export order plus the graph-level entry/finish marks.
 * Every edge endpoint references an existing node (checked by the parser).
 */
public final class FlowGraph {

    private final String name;
    private final Map<String, FlowNode> nodes;
    private final List<FlowEdge> edges;
    private final String markedEntryId;
    private final List<String> markedFinishIds;

    public FlowGraph(String name, List<FlowNode> nodes, List<FlowEdge> edges,
                     String markedEntryId, List<String> markedFinishIds) {
        this.name = name;
        Map<String, FlowNode> byId = new LinkedHashMap<>();
        nodes.forEach(n -> byId.put(n.getId(), n));
        this.nodes = Collections.unmodifiableMap(byId);
        this.edges = List.copyOf(edges);
        this.markedEntryId = markedEntryId;
        this.markedFinishIds = markedFinishIds != null ? List.copyOf(markedFinishIds) : List.of();
    }

    public String getName() {
        return name;
    }

    public List<FlowNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    public FlowNode node(String id) {
        FlowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return node;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public List<FlowEdge> getEdges() {
        return edges;
    }

    public List<FlowEdge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.sourceId().equals(nodeId)).toList();
    }

    public List<FlowEdge> incoming(String nodeId) {
        return edges.stream().filter(e -> e.targetId().equals(nodeId)).toList();
    }

    /** Explicit entry: the top-level mark, else nodes with role ENTRY. */
    public List<String> explicitEntryIds() {
        List<String> ids = new ArrayList<>();
        if (markedEntryId != null) ids.add(markedEntryId);
        nodes.values().stream()
                .filter(n -> n.getRole() == NodeRole.ENTRY)
                .map(FlowNode::getId)
                .filter(id -> !ids.contains(id))
                .forEach(ids::add);
        return ids;
    }

    /** Explicit finishes: the top-level marks plus nodes with role FINISH. */
    public List<String> explicitFinishIds() {
        List<String> ids = new ArrayList<>(markedFinishIds);
        nodes.values().stream()
                .filter(n -> n.getRole() == NodeRole.FINISH)
                .map(FlowNode::getId)
                .filter(id -> !ids.contains(id))
                .forEach(ids::add);
        return ids;
    }

    /** Returns a copy with every node replaced by {@code mapper}'s result; edges and marks are shared. */
    public FlowGraph withNodes(UnaryOperator<FlowNode> mapper) {
        List<FlowNode> mapped = nodes.values().stream().map(mapper).toList();
        return new FlowGraph(name, mapped, edges, markedEntryId, markedFinishIds);
    }
}
