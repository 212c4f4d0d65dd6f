package com.nexflow.nexflow_compiler.generator;

import com.nexflow.nexflow_compiler.TestFlows;
import com.nexflow.nexflow_compiler.analysis.FlowAnalyzer;
import com.nexflow.nexflow_compiler.analysis.FlowPlan;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.schema.StateSchema;
import com.nexflow.nexflow_compiler.schema.StateSchemaSynthesizer;
import com.nexflow.nexflow_compiler.template.TestTemplates;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PythonCodeGeneratorTest {

    private final PythonCodeGenerator generator =
            new PythonCodeGenerator(TestTemplates.registry(TestFlows.PROPERTIES), TestFlows.PROPERTIES);

    private GeneratedProgram generate(String exportJson) {
        FlowGraph graph = TestFlows.mapped(exportJson);
        StateSchema schema = new StateSchemaSynthesizer(TestFlows.PROPERTIES).synthesize(graph);
        FlowPlan plan = new FlowAnalyzer(TestFlows.PROPERTIES).analyze(graph, schema);
        return generator.generate(graph, schema, plan);
    }

    @Test
    void linearChainProgram() {
        String code = generate(TestFlows.read("linear_chain.json")).text();

        assertThat(code).startsWith("\"\"\"LangGraph program generated from flow 'Linear Chain'.\"\"\"\n");
        assertThat(code).contains(
                "from langgraph.graph import END, START, StateGraph\n",
                "class GraphState(TypedDict, total=False):\n",
                "    input: str\n",
                "    llm_response: str\n",
                "def create_graph():\n",
                "    graph = StateGraph(GraphState)\n",
                "    def prompt(state):\n",
                "        \"\"\"Prompt node 'Prompt' (prompt).\"\"\"\n",
                "        template = \"Answer briefly: {input}\"\n",
                "        # LLM: OpenAI (model gpt-4o-mini, temperature 0.2)\n",
                "    graph.add_node(\"llm\", llm)\n",
                "    graph.add_edge(START, \"start\")\n",
                "    graph.add_edge(\"start\", \"prompt\")\n",
                "    graph.add_edge(\"prompt\", \"llm\")\n",
                "    graph.add_edge(\"llm\", \"end\")\n",
                "    graph.add_edge(\"end\", END)\n",
                "    return graph.compile()\n",
                "if __name__ == \"__main__\":\n",
                "    result = app.invoke({\"input\": \"Test input\"})\n");
        assertThat(code).doesNotContain("# --- Routing ---", "add_conditional_edges");
        assertThat(code.indexOf("def start(state)")).isLessThan(code.indexOf("def prompt(state)"));
        assertThat(code.indexOf("def llm(state)")).isLessThan(code.indexOf("def end(state)"));
    }

    @Test
    void branchRoutingIsExhaustive() {
        String code = generate(TestFlows.read("router_no_default.json")).text();

        assertThat(code).contains(
                "    def route_after_classify(state):\n",
                "        if state.get(\"route\") == \"positive\":\n",
                "            return \"positive\"\n",
                "        elif state.get(\"route\") == \"negative\":\n",
                "            return \"negative\"\n",
                "        return \"__default__\"\n",
                "    graph.add_conditional_edges(\n"
                        + "        \"classify\",\n"
                        + "        route_after_classify,\n"
                        + "        {\n"
                        + "            \"positive\": \"happy_path\",\n"
                        + "            \"negative\": \"sad_path\",\n"
                        + "            \"__default__\": END,\n"
                        + "        },\n"
                        + "    )\n",
                "    graph.add_edge(\"happy_path\", END)\n",
                "    graph.add_edge(\"sad_path\", END)\n");
    }

    @Test
    void loopBackEdgeThroughDecider() {
        String code = generate(TestFlows.read("loop_counter.json")).text();

        assertThat(code).contains(
                "    attempts: float\n",
                "        state[\"attempts\"] = state.get(\"attempts\", 0) + 1\n",
                "        if state.get(\"attempts\") < 3:\n",
                "            return \"work\"\n",
                "            \"work\": \"work\",\n",
                "            \"__default__\": \"done\",\n",
                "    graph.add_edge(\"done\", END)\n");
    }

    @Test
    void plainBackEdgeIsEmittedAfterForwardEdges() {
        String code = generate("""
                { "nodes": [
                    { "id": "a", "type": "Prompt", "label": "Draft" },
                    { "id": "b", "type": "CustomComponent", "label": "Review",
                      "config": { "code": "state[\\"rounds\\"] = state.get(\\"rounds\\", 0) + 1" } },
                    { "id": "c", "type": "Chain", "label": "Gate" },
                    { "id": "d", "type": "Chain", "label": "Revise" },
                    { "id": "z", "type": "Chain", "label": "Publish" }
                  ],
                  "edges": [
                    { "source": "a", "target": "b" },
                    { "source": "b", "target": "c" },
                    { "source": "c", "target": "d", "condition": "rounds < 2" },
                    { "source": "c", "target": "z", "condition": "else" },
                    { "source": "d", "target": "b" }
                  ] }
                """).text();

        assertThat(code).contains(
                "    graph.add_edge(\"review\", \"gate\")\n"
                        + "    # loop back-edge\n"
                        + "    graph.add_edge(\"revise\", \"review\")\n"
                        + "    graph.add_conditional_edges(\n",
                "        if state.get(\"rounds\") < 2:\n",
                "            return \"revise\"\n",
                "            \"__default__\": \"publish\",\n",
                "    graph.add_edge(\"publish\", END)\n");
    }

    @Test
    void keywordFieldsUseFunctionalTypedDict() {
        String code = generate("""
                { "nodes": [ { "id": "a", "type": "Chain", "outputs": [ "class" ] } ], "edges": [] }
                """).text();

        assertThat(code).contains(
                "GraphState = TypedDict(\n",
                "    \"GraphState\",\n",
                "        \"class\": str,\n",
                "    total=False,\n");
    }

    @Test
    void duplicateEdgesAreEmittedOnce() {
        GeneratedProgram program = generate("""
                { "nodes": [ { "id": "a", "type": "Chain" }, { "id": "b", "type": "Tool" } ],
                  "edges": [ { "source": "a", "target": "b" }, { "source": "a", "target": "b" } ] }
                """);

        assertThat(program.text().split("graph.add_edge\\(\"a\", \"b\"\\)", -1)).hasSize(2);
        assertThat(program.warnings()).containsExactly("Duplicate edge a->b#1 emitted once");
    }

    @Test
    void sameFlowSameText() {
        String export = TestFlows.read("langflow_export.json");

        assertThat(generate(export).text()).isEqualTo(generate(export).text());
    }
}
