package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.generator.CodeWriter;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeCategory;
import org.springframework.stereotype.Component;

/*
 * Config shape:
 * {
 *   "model_name":  "gpt-4o-mini",
 *   "temperature": 0.2
 * }
 * The generated body only shapes the state; no model is called.
 */
abstract class ModelTemplate extends BaseNodeTemplate {

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        String model = node.configString("model_name", node.configString("model", "default"));
        header(node, out, "model " + model + ", temperature " + number(node, "temperature", "0.7"));
        writeResponse(out);
    }

    protected abstract void writeResponse(CodeWriter out);
}

@Component
class LlmTemplate extends ModelTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.LLM; }

    @Override
    protected void writeResponse(CodeWriter out) {
        out.open("if \"prompt\" in state:");
        out.line("state[\"llm_response\"] = f\"Response to: {state['prompt']}\"");
        out.dedent().open("elif \"input\" in state:");
        out.line("state[\"llm_response\"] = f\"Response to: {state['input']}\"");
        out.dedent().open("else:");
        out.line("state[\"llm_response\"] = \"No input provided\"");
        out.dedent();
    }
}

@Component
class ChatModelTemplate extends ModelTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.CHAT_MODEL; }

    @Override
    protected void writeResponse(CodeWriter out) {
        out.line("messages = state.get(\"messages\") or []");
        out.open("if messages:");
        out.line("state[\"chat_response\"] = f\"Response to {len(messages)} message(s): {messages[-1]}\"");
        out.dedent().open("elif \"input\" in state:");
        out.line("state[\"chat_response\"] = f\"Response to: {state['input']}\"");
        out.dedent().open("else:");
        out.line("state[\"chat_response\"] = \"No input provided\"");
        out.dedent();
    }
}
