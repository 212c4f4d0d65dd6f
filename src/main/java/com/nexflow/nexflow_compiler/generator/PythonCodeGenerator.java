package com.nexflow.nexflow_compiler.generator;

import com.nexflow.nexflow_compiler.analysis.BranchPoint;
import com.nexflow.nexflow_compiler.analysis.BranchRoute;
import com.nexflow.nexflow_compiler.analysis.ClassifiedEdge;
import com.nexflow.nexflow_compiler.analysis.EdgeKind;
import com.nexflow.nexflow_compiler.analysis.FlowPlan;
import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.model.domain.FieldType;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.schema.StateSchema;
import com.nexflow.nexflow_compiler.template.NodeTemplateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.nexflow.nexflow_compiler.generator.PythonLiterals.quote;

/**
 * Emits the LangGraph program for an analyzed flow.
 *
 * Layout:
 *   module docstring, imports
 *   class GraphState(TypedDict, total=False)
 *   def create_graph():
 *       # --- Nodes ---     one nested function per node, in visit order, then add_node
 *       # --- Routing ---   route_after_<node> per branch point
 *       # --- Edges ---     START, forward edges, loop back-edges, conditional edges, END
 *       return graph.compile()
 *   if __name__ == "__main__": block
 *
 * Output depends only on its inputs; the same flow always yields the same text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PythonCodeGenerator {

    public static final String DEFAULT_ROUTE_KEY = "__default__";

    private final NodeTemplateRegistry templates;
    private final ConverterProperties properties;

    public GeneratedProgram generate(FlowGraph graph, StateSchema schema, FlowPlan plan) {
        List<String> warnings = new ArrayList<>();
        CodeWriter out = new CodeWriter(properties.indentString());

        writeHeader(graph, out);
        writeState(schema, out);

        out.blankLine().blankLine();
        out.open("def create_graph():");
        out.line("\"\"\"Build and compile the state graph.\"\"\"");
        out.line("graph = StateGraph(GraphState)");

        out.blankLine().line("# --- Nodes ---");
        for (String nodeId : plan.getVisitOrder()) {
            writeNode(graph.node(nodeId), plan, out);
        }

        if (plan.hasBranches()) {
            out.blankLine().line("# --- Routing ---");
            for (BranchPoint point : plan.getBranchPoints()) {
                writeRouter(graph.node(point.sourceId()), point, plan, out);
            }
        }

        out.blankLine().line("# --- Edges ---").blankLine();
        writeEdges(plan, out, warnings);

        out.blankLine().line("return graph.compile()");
        out.dedent();

        writeMain(out);
        log.debug("Generated {} characters for flow '{}'", out.toString().length(), graph.getName());
        return new GeneratedProgram(out.toString(), warnings);
    }

    // ── Module header and state ───────────────────────────────────────────────

    private void writeHeader(FlowGraph graph, CodeWriter out) {
        out.line("\"\"\"LangGraph program generated from flow '%s'.\"\"\"", docText(graph.getName()));
        out.blankLine();
        out.line("from typing import Any, Dict, List, TypedDict");
        out.blankLine();
        out.line("from langgraph.graph import END, START, StateGraph");
    }

    private void writeState(StateSchema schema, CodeWriter out) {
        out.blankLine().blankLine();
        boolean keywordField = schema.fieldNames().stream().anyMatch(NodeNaming::isPythonKeyword);
        if (keywordField) {
            // class syntax cannot declare keyword-named fields
            out.open("GraphState = TypedDict(");
            out.line("\"GraphState\",");
            out.open("{");
            schema.fields().forEach((name, type) -> out.line("%s: %s,", quote(name), type.pythonAnnotation()));
            out.dedent().line("},");
            out.line("total=False,");
            out.dedent().line(")");
            return;
        }
        out.open("class GraphState(TypedDict, total=False):");
        out.line("\"\"\"State shared by all nodes of the flow.\"\"\"");
        if (!schema.isEmpty()) out.blankLine();
        for (Map.Entry<String, FieldType> field : schema.fields().entrySet()) {
            out.line("%s: %s", field.getKey(), field.getValue().pythonAnnotation());
        }
        out.dedent();
    }

    // ── Nodes and routers ─────────────────────────────────────────────────────

    private void writeNode(FlowNode node, FlowPlan plan, CodeWriter out) {
        String name = plan.functionName(node.getId());
        out.blankLine();
        out.open("def " + name + "(state):");
        out.line("\"\"\"%s node '%s' (%s).\"\"\"",
                node.getCategory().displayName(), docText(node.displayLabel()), docText(node.getId()));
        templates.get(node.getCategory()).writeBody(node, out);
        out.line("return state");
        out.dedent();
        out.blankLine();
        out.line("graph.add_node(%s, %s)", quote(name), name);
    }

    private void writeRouter(FlowNode node, BranchPoint point, FlowPlan plan, CodeWriter out) {
        String routerName = NodeNaming.routerName(plan.functionName(node.getId()));
        out.blankLine();
        out.open("def " + routerName + "(state):");
        out.line("\"\"\"Pick the route out of '%s'.\"\"\"", docText(node.displayLabel()));
        boolean first = true;
        for (BranchRoute route : point.routes()) {
            out.open((first ? "if " : "elif ") + route.pythonTest() + ":");
            out.line("return %s", quote(route.key()));
            out.dedent();
            first = false;
        }
        out.line("return %s", quote(DEFAULT_ROUTE_KEY));
        out.dedent();
    }

    // ── Edges ─────────────────────────────────────────────────────────────────

    private void writeEdges(FlowPlan plan, CodeWriter out, List<String> warnings) {
        out.line("graph.add_edge(START, %s)", quote(plan.functionName(plan.getEntryId())));

        Set<String> emitted = new HashSet<>();
        for (ClassifiedEdge edge : plan.edgesOfKind(EdgeKind.FORWARD)) {
            writeEdge(edge, plan, out, emitted, warnings, false);
        }
        for (ClassifiedEdge edge : plan.edgesOfKind(EdgeKind.LOOP_BACK)) {
            writeEdge(edge, plan, out, emitted, warnings, true);
        }

        for (BranchPoint point : plan.getBranchPoints()) {
            String source = plan.functionName(point.sourceId());
            out.open("graph.add_conditional_edges(");
            out.line("%s,", quote(source));
            out.line("%s,", NodeNaming.routerName(source));
            out.open("{");
            for (BranchRoute route : point.routes()) {
                out.line("%s: %s,", quote(route.key()), quote(plan.functionName(route.targetId())));
            }
            String fallback = point.defaultsToEnd() ? "END" : quote(plan.functionName(point.defaultTargetId()));
            out.line("%s: %s,", quote(DEFAULT_ROUTE_KEY), fallback);
            out.dedent().line("},");
            out.dedent().line(")");
        }

        for (String finishId : plan.getFinishIds()) {
            out.line("graph.add_edge(%s, END)", quote(plan.functionName(finishId)));
        }
    }

    private void writeEdge(ClassifiedEdge edge, FlowPlan plan, CodeWriter out, Set<String> emitted,
                           List<String> warnings, boolean loopBack) {
        String source = plan.functionName(edge.sourceId());
        String target = plan.functionName(edge.targetId());
        if (!emitted.add(source + "->" + target)) {
            warnings.add("Duplicate edge " + edge.edge().ref() + " emitted once");
            return;
        }
        if (loopBack) out.line("# loop back-edge");
        out.line("graph.add_edge(%s, %s)", quote(source), quote(target));
    }

    private void writeMain(CodeWriter out) {
        out.blankLine().blankLine();
        out.open("if __name__ == \"__main__\":");
        out.line("app = create_graph()");
        out.line("result = app.invoke({\"input\": \"Test input\"})");
        out.line("print(result)");
        out.dedent();
    }

    // Text safe inside a one-line triple-quoted docstring
    private static String docText(String value) {
        if (value == null) return "";
        return value.replace("\\", "\\\\").replace("\"", "'").replaceAll("[\\r\\n]+", " ").trim();
    }
}
