package com.nexflow.nexflow_compiler.analysis;

import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.exception.StructuralException;
import com.nexflow.nexflow_compiler.generator.NodeNaming;
import com.nexflow.nexflow_compiler.generator.PythonCodeGenerator;
import com.nexflow.nexflow_compiler.generator.PythonLiterals;
import com.nexflow.nexflow_compiler.model.domain.FlowEdge;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.schema.StateSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Works out the control flow of a mapped graph.
 *
 * Steps:
 *   1. Resolve the entry node (explicit mark, else the single node nothing points to)
 *   2. DFS from the entry in edge-declaration order; an edge onto the DFS path is a loop back-edge
 *   3. Every outgoing edge of a routing node (Router category, or any conditioned edge) becomes a branch
 *   4. Every back-edge must close a loop that some branch can leave, based on a field the body updates
 *   5. Resolve the finish nodes (explicit marks, else nodes without outgoing edges)
 *
 * Purely analytical: the same graph always yields the same plan.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowAnalyzer {

    private final ConverterProperties properties;

    public FlowPlan analyze(FlowGraph graph, StateSchema schema) {
        if (graph.nodeCount() == 0) {
            throw new StructuralException("Flow '" + graph.getName() + "' has no nodes", List.of());
        }
        List<String> warnings = new ArrayList<>();
        Map<String, String> names = NodeNaming.assign(graph);

        String entryId = resolveEntry(graph);

        // ── Traversal ─────────────────────────────────────────────────────────
        Map<Integer, EdgeKind> kinds = new HashMap<>();
        Set<String> visited = new HashSet<>();
        List<String> visitOrder = new ArrayList<>(reversePostOrder(graph, entryId, visited, kinds));
        Set<String> reachable = new HashSet<>(visited);

        for (FlowNode node : graph.getNodes()) {
            if (visited.contains(node.getId())) continue;
            warnings.add("Node '" + node.getId() + "' is not reachable from entry '" + entryId + "'");
            visitOrder.addAll(reversePostOrder(graph, node.getId(), visited, kinds));
        }

        // ── Branches ──────────────────────────────────────────────────────────
        Set<String> branching = new LinkedHashSet<>();
        for (String id : visitOrder) {
            if (isBranching(graph, graph.node(id))) branching.add(id);
        }

        List<ClassifiedEdge> classified = new ArrayList<>();
        for (FlowEdge edge : graph.getEdges()) {
            boolean back = kinds.get(edge.index()) == EdgeKind.LOOP_BACK;
            if (branching.contains(edge.sourceId())) {
                classified.add(new ClassifiedEdge(edge, EdgeKind.BRANCH, back));
            } else {
                classified.add(new ClassifiedEdge(edge, back ? EdgeKind.LOOP_BACK : EdgeKind.FORWARD, false));
            }
        }

        List<BranchPoint> branchPoints = new ArrayList<>();
        for (String id : branching) {
            BranchPoint point = buildBranchPoint(graph, graph.node(id), names);
            if (point.defaultSynthesized()) {
                warnings.add("Branch node '" + id + "' has no default route; unmatched states go to END");
                log.warn("Flow '{}': branch node '{}' has no default route, routing unmatched states to END",
                        graph.getName(), id);
            }
            branchPoints.add(point);
        }

        // ── Loops ─────────────────────────────────────────────────────────────
        List<LoopInfo> loops = new ArrayList<>();
        for (ClassifiedEdge edge : classified) {
            if (edge.kind() == EdgeKind.LOOP_BACK || edge.closesLoop()) {
                loops.add(checkLoop(graph, schema, edge.edge(), visitOrder, branching));
            }
        }

        List<String> finishIds = resolveFinish(graph, reachable, warnings);

        log.debug("Flow '{}': entry={}, finish={}, {} branch point(s), {} loop(s)",
                graph.getName(), entryId, finishIds, branchPoints.size(), loops.size());
        return new FlowPlan(entryId, finishIds, visitOrder, classified, branchPoints, loops, names, warnings);
    }

    // ── Entry / finish ────────────────────────────────────────────────────────

    private String resolveEntry(FlowGraph graph) {
        List<String> marked = graph.explicitEntryIds();
        if (marked.size() > 1) {
            throw new StructuralException("Conflicting entry marks: " + marked, marked);
        }
        if (marked.size() == 1) return marked.get(0);

        List<String> candidates = graph.getNodes().stream()
                .map(FlowNode::getId)
                .filter(id -> graph.incoming(id).isEmpty())
                .toList();
        if (candidates.isEmpty()) {
            throw new StructuralException("No entry node: every node has an incoming edge; mark one as entry",
                    graph.getNodes().stream().map(FlowNode::getId).toList());
        }
        if (candidates.size() > 1) {
            throw new StructuralException("Ambiguous entry: nodes " + candidates
                    + " have no incoming edges; mark one as entry", candidates);
        }
        return candidates.get(0);
    }

    private List<String> resolveFinish(FlowGraph graph, Set<String> reachable, List<String> warnings) {
        List<String> finish = graph.explicitFinishIds();
        for (String id : finish) {
            List<FlowEdge> onward = graph.outgoing(id);
            if (!onward.isEmpty()) {
                List<String> ids = new ArrayList<>();
                ids.add(id);
                onward.forEach(edge -> ids.add(edge.ref()));
                throw new StructuralException("Finish node '" + id + "' has outgoing edges "
                        + onward.stream().map(FlowEdge::ref).toList() + "; a finish node must end the flow", ids);
            }
        }
        if (finish.isEmpty()) {
            finish = graph.getNodes().stream()
                    .map(FlowNode::getId)
                    .filter(id -> graph.outgoing(id).isEmpty())
                    .toList();
        }
        if (finish.isEmpty()) {
            throw new StructuralException("No finish node: every node has an outgoing edge; mark one as finish",
                    List.of());
        }
        if (finish.stream().noneMatch(reachable::contains)) {
            throw new StructuralException("No finish node is reachable from the entry", finish);
        }
        finish.stream()
                .filter(id -> !reachable.contains(id))
                .forEach(id -> warnings.add("Finish node '" + id + "' is not reachable from the entry"));
        return finish;
    }

    // ── Traversal ─────────────────────────────────────────────────────────────

    // Iterative DFS from root; classifies every edge it walks and returns the reverse post-order
    private List<String> reversePostOrder(FlowGraph graph, String root, Set<String> visited, Map<Integer, EdgeKind> kinds) {
        List<String> postOrder = new ArrayList<>();
        Set<String> onStack = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        visited.add(root);
        onStack.add(root);
        stack.push(new Frame(root, graph.outgoing(root)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next < frame.edges.size()) {
                FlowEdge edge = frame.edges.get(frame.next++);
                String target = edge.targetId();
                if (onStack.contains(target)) {
                    kinds.put(edge.index(), EdgeKind.LOOP_BACK);
                } else {
                    kinds.put(edge.index(), EdgeKind.FORWARD);
                    if (visited.add(target)) {
                        onStack.add(target);
                        stack.push(new Frame(target, graph.outgoing(target)));
                    }
                }
            } else {
                stack.pop();
                onStack.remove(frame.nodeId);
                postOrder.add(frame.nodeId);
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }

    private static final class Frame {
        final String nodeId;
        final List<FlowEdge> edges;
        int next;

        Frame(String nodeId, List<FlowEdge> edges) {
            this.nodeId = nodeId;
            this.edges = edges;
        }
    }

    // ── Branches ──────────────────────────────────────────────────────────────

    private static boolean isBranching(FlowGraph graph, FlowNode node) {
        List<FlowEdge> outgoing = graph.outgoing(node.getId());
        if (outgoing.isEmpty()) return false;
        return node.isRouter() || outgoing.stream().anyMatch(FlowEdge::isConditioned);
    }

    private BranchPoint buildBranchPoint(FlowGraph graph, FlowNode node, Map<String, String> names) {
        String routeField = properties.routeFieldOf(node);
        List<BranchRoute> routes = new ArrayList<>();
        Set<String> usedKeys = new HashSet<>(Set.of(PythonCodeGenerator.DEFAULT_ROUTE_KEY));
        String defaultTarget = null;
        FlowEdge defaultEdge = null;

        for (FlowEdge edge : graph.outgoing(node.getId())) {
            String targetName = names.get(edge.targetId());
            if (edge.isConditioned()) {
                ConditionExpression condition = ConditionExpression.parse(edge.condition());
                switch (condition.kind()) {
                    case DEFAULT -> {
                        requireSingleDefault(node, defaultEdge, edge);
                        defaultEdge = edge;
                        defaultTarget = edge.targetId();
                    }
                    case VALUE -> routes.add(new BranchRoute(uniqueKey(condition.routeKey(), usedKeys),
                            edge.targetId(), condition.toPython(routeField), edge.ref()));
                    case PREDICATE -> routes.add(new BranchRoute(uniqueKey(targetName, usedKeys),
                            edge.targetId(), condition.toPython(routeField), edge.ref()));
                }
            } else if (node.isRouter()) {
                String test = "state.get(" + PythonLiterals.quote(routeField) + ") == " + PythonLiterals.quote(targetName);
                routes.add(new BranchRoute(uniqueKey(targetName, usedKeys), edge.targetId(), test, edge.ref()));
            } else {
                // an unconditioned edge next to conditioned siblings is the fallback
                requireSingleDefault(node, defaultEdge, edge);
                defaultEdge = edge;
                defaultTarget = edge.targetId();
            }
        }
        return new BranchPoint(node.getId(), routeField, routes, defaultTarget, defaultEdge == null);
    }

    private static void requireSingleDefault(FlowNode node, FlowEdge existing, FlowEdge another) {
        if (existing != null) {
            throw new StructuralException("Branch node '" + node.getId() + "' has more than one default route: "
                    + existing.ref() + ", " + another.ref(), List.of(node.getId(), existing.ref(), another.ref()));
        }
    }

    private static String uniqueKey(String key, Set<String> used) {
        String candidate = key;
        for (int n = 2; !used.add(candidate); n++) {
            candidate = key + "_" + n;
        }
        return candidate;
    }

    // ── Loops ─────────────────────────────────────────────────────────────────

    private LoopInfo checkLoop(FlowGraph graph, StateSchema schema, FlowEdge backEdge, List<String> visitOrder,
                               Set<String> branching) {
        Set<String> fromHead = reach(backEdge.targetId(), id -> graph.outgoing(id).stream().map(FlowEdge::targetId).toList());
        Set<String> toTail = reach(backEdge.sourceId(), id -> graph.incoming(id).stream().map(FlowEdge::sourceId).toList());

        List<String> body = visitOrder.stream().filter(id -> fromHead.contains(id) && toTail.contains(id)).toList();
        List<String> deciders = body.stream().filter(branching::contains).toList();
        if (deciders.isEmpty()) {
            throw new StructuralException("Loop closed by edge " + backEdge.ref()
                    + " has no branching node that can leave it", withEdge(backEdge, body));
        }

        Set<String> reads = new LinkedHashSet<>();
        for (String deciderId : deciders) {
            FlowNode decider = graph.node(deciderId);
            String routeField = properties.routeFieldOf(decider);
            for (FlowEdge edge : graph.outgoing(deciderId)) {
                if (edge.isConditioned()) {
                    ConditionExpression.parse(edge.condition()).referencedFields(routeField)
                            .forEach(spec -> reads.add(spec.name()));
                } else if (decider.isRouter()) {
                    reads.add(routeField);
                }
            }
        }

        Set<String> writes = new LinkedHashSet<>();
        body.stream()
                .filter(id -> !deciders.contains(id))
                .forEach(id -> writes.addAll(graph.node(id).getContract().writeNames()));

        List<String> exitFields = reads.stream()
                .filter(writes::contains)
                .filter(schema::contains)
                .toList();
        if (exitFields.isEmpty()) {
            throw new StructuralException("Loop closed by edge " + backEdge.ref()
                    + " never updates a field its exit depends on (exit reads " + reads
                    + ", loop body writes " + writes + ")", withEdge(backEdge, deciders));
        }
        log.debug("Loop {}: body={}, deciders={}, exit fields={}", backEdge.ref(), body, deciders, exitFields);
        return new LoopInfo(backEdge, body, deciders, exitFields);
    }

    private static Set<String> reach(String start, Function<String, List<String>> next) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            for (String neighbour : next.apply(queue.poll())) {
                if (seen.add(neighbour)) queue.add(neighbour);
            }
        }
        return seen;
    }

    private static List<String> withEdge(FlowEdge edge, List<String> ids) {
        List<String> all = new ArrayList<>();
        all.add(edge.ref());
        all.addAll(ids);
        return all;
    }
}
