package com.nexflow.nexflow_compiler.analysis;

import com.nexflow.nexflow_compiler.TestFlows;
import com.nexflow.nexflow_compiler.exception.StructuralException;
import com.nexflow.nexflow_compiler.model.domain.FlowEdge;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.schema.StateSchemaSynthesizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowAnalyzerTest {

    private final FlowAnalyzer analyzer = new FlowAnalyzer(TestFlows.PROPERTIES);
    private final StateSchemaSynthesizer synthesizer = new StateSchemaSynthesizer(TestFlows.PROPERTIES);

    private FlowPlan analyze(String exportJson) {
        FlowGraph graph = TestFlows.mapped(exportJson);
        return analyzer.analyze(graph, synthesizer.synthesize(graph));
    }

    @Test
    void linearChain() {
        FlowPlan plan = analyze(TestFlows.read("linear_chain.json"));

        assertThat(plan.getEntryId()).isEqualTo("start");
        assertThat(plan.getFinishIds()).containsExactly("end");
        assertThat(plan.getVisitOrder()).containsExactly("start", "prompt", "llm", "end");
        assertThat(plan.edgesOfKind(EdgeKind.FORWARD)).hasSize(3);
        assertThat(plan.hasLoops()).isFalse();
        assertThat(plan.hasBranches()).isFalse();
        assertThat(plan.getWarnings()).isEmpty();
    }

    @Test
    void acyclicVisitOrderIsTopological() {
        FlowPlan plan = analyze("""
                { "nodes": [
                    { "id": "d", "type": "Chain" }, { "id": "b", "type": "Tool" },
                    { "id": "a", "type": "Prompt" }, { "id": "c", "type": "Tool" }
                  ],
                  "edges": [
                    { "source": "a", "target": "b" }, { "source": "a", "target": "c" },
                    { "source": "b", "target": "d" }, { "source": "c", "target": "d" }
                  ] }
                """);

        List<String> order = plan.getVisitOrder();
        for (ClassifiedEdge edge : plan.getEdges()) {
            assertThat(order.indexOf(edge.sourceId())).isLessThan(order.indexOf(edge.targetId()));
        }
        assertThat(plan.edgesOfKind(EdgeKind.LOOP_BACK)).isEmpty();
        assertThat(order.get(0)).isEqualTo("a");
    }

    @Test
    void routerWithoutDefaultGetsSynthesizedDefaultAndWarning() {
        FlowPlan plan = analyze(TestFlows.read("router_no_default.json"));

        BranchPoint point = plan.branchPointOf("classify").orElseThrow();
        assertThat(point.routes()).extracting(BranchRoute::key).containsExactly("positive", "negative");
        assertThat(point.routes()).extracting(BranchRoute::targetId).containsExactly("happy", "sad");
        assertThat(point.defaultSynthesized()).isTrue();
        assertThat(point.defaultsToEnd()).isTrue();
        assertThat(plan.getWarnings()).contains("Branch node 'classify' has no default route; unmatched states go to END");
        assertThat(plan.getFinishIds()).containsExactly("happy", "sad");
    }

    @Test
    void unconditionedRouterEdgesRouteByTargetName() {
        FlowPlan plan = analyze("""
                { "nodes": [
                    { "id": "r", "type": "Router", "label": "Pick" },
                    { "id": "x", "type": "Chain", "label": "Billing" },
                    { "id": "y", "type": "Chain", "label": "Support" }
                  ],
                  "edges": [ { "source": "r", "target": "x" }, { "source": "r", "target": "y" } ] }
                """);

        BranchPoint point = plan.branchPointOf("r").orElseThrow();
        assertThat(point.routes()).extracting(BranchRoute::key).containsExactly("billing", "support");
        assertThat(point.routes().get(0).pythonTest()).isEqualTo("state.get(\"route\") == \"billing\"");
    }

    @Test
    void unconditionedSiblingBecomesTheDefault() {
        FlowPlan plan = analyze("""
                { "nodes": [
                    { "id": "a", "type": "Chain" }, { "id": "b", "type": "Tool" }, { "id": "c", "type": "Tool" }
                  ],
                  "edges": [
                    { "source": "a", "target": "b", "condition": "chain_result == 'ok'" },
                    { "source": "a", "target": "c" }
                  ] }
                """);

        BranchPoint point = plan.branchPointOf("a").orElseThrow();
        assertThat(point.defaultTargetId()).isEqualTo("c");
        assertThat(point.defaultSynthesized()).isFalse();
        assertThat(point.routes()).singleElement().satisfies(route -> {
            assertThat(route.key()).isEqualTo("ok");
            assertThat(route.pythonTest()).isEqualTo("state.get(\"chain_result\") == \"ok\"");
        });
    }

    @Test
    void twoDefaultsAreRejected() {
        assertThatThrownBy(() -> analyze("""
                { "nodes": [
                    { "id": "a", "type": "Chain" }, { "id": "b", "type": "Tool" }, { "id": "c", "type": "Tool" }
                  ],
                  "edges": [
                    { "source": "a", "target": "b", "condition": "else" },
                    { "source": "a", "target": "c", "condition": "default" }
                  ] }
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("more than one default route");
    }

    @Test
    void loopWithUpdatedExitFieldIsAccepted() {
        FlowPlan plan = analyze(TestFlows.read("loop_counter.json"));

        assertThat(plan.hasLoops()).isTrue();
        LoopInfo loop = plan.getLoops().get(0);
        FlowEdge backEdge = loop.backEdge();
        assertThat(backEdge.sourceId()).isEqualTo("check");
        assertThat(backEdge.targetId()).isEqualTo("work");
        assertThat(loop.bodyIds()).containsExactly("work", "check");
        assertThat(loop.deciderIds()).containsExactly("check");
        assertThat(loop.exitFields()).containsExactly("attempts");
        assertThat(plan.branchPointOf("check").orElseThrow().defaultTargetId()).isEqualTo("done");
    }

    @Test
    void loopThatNeverUpdatesItsGuardIsRejected() {
        assertThatThrownBy(() -> analyze(TestFlows.read("loop_without_update.json")))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("never updates a field its exit depends on")
                .satisfies(ex -> assertThat(((StructuralException) ex).getOffendingIds())
                        .containsExactly("check->work#2", "check"));
    }

    @Test
    void deciderContractReadsDoNotCountAsExitReads() {
        // the memory node reads what the llm writes, but the guard itself reads a field nobody writes
        assertThatThrownBy(() -> analyze("""
                { "nodes": [
                    { "id": "prep",  "type": "PromptTemplate" },
                    { "id": "llm",   "type": "OpenAI" },
                    { "id": "check", "type": "ConversationBufferMemory" },
                    { "id": "done",  "type": "Chain" }
                  ],
                  "edges": [
                    { "source": "prep",  "target": "llm" },
                    { "source": "llm",   "target": "check" },
                    { "source": "check", "target": "llm",  "condition": "counter < 3" },
                    { "source": "check", "target": "done", "condition": "else" }
                  ] }
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("never updates a field its exit depends on (exit reads [counter]")
                .satisfies(ex -> assertThat(((StructuralException) ex).getOffendingIds())
                        .containsExactly("check->llm#2", "check"));
    }

    @Test
    void loopGuardWithStateGetDefaultIsAccepted() {
        FlowPlan plan = analyze("""
                { "nodes": [
                    { "id": "prep",  "type": "PromptTemplate" },
                    { "id": "work",  "type": "CustomComponent",
                      "config": { "code": "state[\\"attempts\\"] = state.get(\\"attempts\\", 0) + 1" } },
                    { "id": "check", "type": "CustomComponent" },
                    { "id": "done",  "type": "Chain" }
                  ],
                  "edges": [
                    { "source": "prep",  "target": "work" },
                    { "source": "work",  "target": "check" },
                    { "source": "check", "target": "work", "condition": "state.get('attempts', 0) < 3" },
                    { "source": "check", "target": "done", "condition": "else" }
                  ] }
                """);

        LoopInfo loop = plan.getLoops().get(0);
        assertThat(loop.exitFields()).containsExactly("attempts");
        assertThat(plan.branchPointOf("check").orElseThrow().routes())
                .extracting(BranchRoute::pythonTest)
                .containsExactly("state.get(\"attempts\", 0) < 3");
    }

    @Test
    void markedFinishWithOutgoingEdgesIsRejected() {
        assertThatThrownBy(() -> analyze("""
                { "nodes": [ { "id": "a", "type": "Chain" }, { "id": "b", "type": "Tool" } ],
                  "edges": [ { "source": "a", "target": "b" } ],
                  "finish": [ "a" ] }
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Finish node 'a' has outgoing edges [a->b#0]")
                .satisfies(ex -> assertThat(((StructuralException) ex).getOffendingIds())
                        .containsExactly("a", "a->b#0"));
    }

    @Test
    void loopWithoutAnyExitIsRejected() {
        assertThatThrownBy(() -> analyze("""
                { "nodes": [
                    { "id": "a", "type": "Prompt" }, { "id": "b", "type": "Tool" },
                    { "id": "c", "type": "Chain" }, { "id": "z", "type": "Chain" }
                  ],
                  "edges": [
                    { "source": "a", "target": "b" }, { "source": "b", "target": "c" },
                    { "source": "c", "target": "b" }, { "source": "a", "target": "z" }
                  ] }
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("has no branching node that can leave it");
    }

    @Test
    void entryResolution() {
        assertThatThrownBy(() -> analyze("""
                { "nodes": [ { "id": "a" }, { "id": "b" } ], "edges": [] }
                """))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Ambiguous entry");

        FlowPlan plan = analyze("""
                { "nodes": [ { "id": "a" }, { "id": "b", "role": "entry" } ], "edges": [] }
                """);
        assertThat(plan.getEntryId()).isEqualTo("b");
        assertThat(plan.getWarnings()).contains("Node 'a' is not reachable from entry 'b'");
    }

    @Test
    void emptyFlowIsRejected() {
        assertThatThrownBy(() -> analyze("{ \"nodes\": [], \"edges\": [] }"))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("has no nodes");
    }
}
