package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.generator.CodeWriter;
import com.nexflow.nexflow_compiler.generator.PythonLiterals;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeCategory;
import org.springframework.stereotype.Component;

// Nodes that take the input text and produce a derived result

@Component
class ChainTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.CHAIN; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.open("if \"input\" in state:");
        out.line("state[\"chain_result\"] = f\"Chain processed: {state['input']}\"");
        out.dedent();
    }
}

@Component
class AgentTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.AGENT; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.line("tools = state.get(\"tools\") or []");
        out.open("if \"input\" in state:");
        out.line("state[\"agent_result\"] = f\"Agent processed: {state['input']} with {len(tools)} tool(s)\"");
        out.line("state[\"intermediate_steps\"] = [\"Step 1: Thinking\", \"Step 2: Acting\"]");
        out.dedent();
    }
}

@Component
class ToolTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.TOOL; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        String toolName = node.configString("tool_name", node.configString("name", typeName(node)));
        header(node, out, null);
        out.line("tool_name = %s", PythonLiterals.quote(toolName));
        out.open("if \"input\" in state:");
        out.line("state[\"tool_result\"] = f\"{tool_name} executed on: {state['input']}\"");
        out.dedent();
    }
}

// A PythonFunction utility carries its own code; other utilities normalise the input
@Component
class UtilityTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.UTILITY; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        if (node.hasCustomCode()) {
            EmbeddedCode.write(node.configString("code"), out);
            return;
        }
        out.open("if \"input\" in state:");
        out.line("state[\"processed_input\"] = str(state[\"input\"]).strip()");
        out.line("state[\"result\"] = state[\"processed_input\"].upper()");
        out.dedent();
    }
}
