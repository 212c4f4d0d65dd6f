package com.nexflow.nexflow_compiler.generator;

import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Python function names for flow nodes, derived from labels.
 * "Chat Input" -> chat_input, "1st step" -> f_1st_step; a second "Chat Input" -> chat_input_2.
 */
public final class NodeNaming {

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield",
            "match", "case");

    // Names the generated module itself defines or imports
    private static final Set<String> RESERVED = Set.of(
            "graph", "state", "result", "create_graph", "GraphState", "StateGraph", "START", "END",
            "Any", "Dict", "List", "TypedDict", "app");

    private NodeNaming() {}

    /** Names for every node of the graph, unique, assigned in node order. */
    public static Map<String, String> assign(FlowGraph graph) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (FlowNode node : graph.getNodes()) {
            String base = sanitize(node.displayLabel());
            String name = base;
            for (int n = 2; taken.contains(name); n++) {
                name = base + "_" + n;
            }
            taken.add(name);
            names.put(node.getId(), name);
        }
        return names;
    }

    public static String sanitize(String label) {
        String name = label == null ? "" : label.trim().replaceAll("[^A-Za-z0-9_]", "_").toLowerCase(Locale.ROOT);
        name = name.replaceAll("_{2,}", "_").replaceAll("^_+|_+$", "");
        if (name.isEmpty()) return "node";
        if (Character.isDigit(name.charAt(0))) name = "f_" + name;
        if (PYTHON_KEYWORDS.contains(name) || RESERVED.contains(name) || name.startsWith("route_after_")) {
            name = name + "_node";
        }
        return name;
    }

    public static boolean isPythonKeyword(String name) {
        return PYTHON_KEYWORDS.contains(name);
    }

    public static String routerName(String nodeFunctionName) {
        return "route_after_" + nodeFunctionName;
    }
}
