package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.generator.CodeWriter;
import com.nexflow.nexflow_compiler.generator.PythonLiterals;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeCategory;
import org.springframework.stereotype.Component;

/*
 * Config shape:
 * { "template": "Answer briefly: {input}" }
 * Every {field} placeholder is replaced by the matching state value.
 */
@Component
class PromptTemplate extends BaseNodeTemplate {

    private static final String DEFAULT_TEMPLATE = "{input}";

    @Override public NodeCategory supportedCategory() { return NodeCategory.PROMPT; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.line("template = %s", PythonLiterals.quote(node.configString("template", DEFAULT_TEMPLATE)));
        out.line("prompt = template");
        out.open("for key, value in state.items():");
        out.line("prompt = prompt.replace(\"{\" + key + \"}\", str(value))");
        out.dedent();
        out.line("state[\"prompt\"] = prompt");
    }
}

// Config: { "k": 10 } keeps the last k exchanges in chat_history
@Component
class MemoryTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.MEMORY; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.line("history = list(state.get(\"history\") or [])");
        out.open("if \"input\" in state and \"llm_response\" in state:");
        out.line("history.append({\"input\": state[\"input\"], \"output\": state[\"llm_response\"]})");
        out.dedent();
        out.line("state[\"history\"] = history");
        out.line("state[\"chat_history\"] = history[-%s:]", number(node, "k", "10"));
    }
}
