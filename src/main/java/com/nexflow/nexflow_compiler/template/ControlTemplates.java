package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.generator.CodeWriter;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/*
 * Config shape:
 * {
 *   "routeExpression": "'long' if len(state.get('input', '')) > 20 else 'short'",
 *   "routeField":      "route"
 * }
 * routeExpression is trusted Python, like config.code: it is emitted verbatim (joined onto one
 * line) as the right-hand side of route_value, not translated the way edge conditions are.
 * Without an expression the router keeps a route set upstream, else routes on the input text.
 * The routing functions emitted by the generator read the route field.
 */
@Component
@RequiredArgsConstructor
class RouterTemplate extends BaseNodeTemplate {

    private final ConverterProperties properties;

    @Override public NodeCategory supportedCategory() { return NodeCategory.ROUTER; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        String routeField = properties.routeFieldOf(node);
        String expression = node.configString("routeExpression", node.configString("expression"));
        header(node, out, null);
        if (node.hasCustomCode()) {
            EmbeddedCode.write(node.configString("code"), out);
            out.line("route_value = state.get(\"%s\")", routeField);
        } else if (expression != null && !expression.isBlank()) {
            out.line("route_value = %s", expression.replaceAll("[\\r\\n]+", " ").trim());
        } else {
            out.line("route_value = state.get(\"%s\") or str(state.get(\"input\", \"\")).strip().lower()", routeField);
        }
        out.line("state[\"%s\"] = route_value", routeField);
        if (!"route".equals(routeField)) {
            out.line("state[\"route\"] = route_value");
        }
        out.line("state[\"destination\"] = route_value");
    }
}

@Component
class OutputParserTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.OUTPUT_PARSER; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        out.line("import json");
        out.line("raw = str(state.get(\"input\", \"\")).strip()");
        out.open("try:");
        out.line("parsed = json.loads(raw) if raw.startswith(\"{\") else {\"output\": raw}");
        out.dedent().open("except ValueError as exc:");
        out.line("parsed = {\"error\": str(exc), \"original_input\": raw}");
        out.dedent();
        out.line("state[\"parsed_output\"] = parsed if isinstance(parsed, dict) else {\"output\": parsed}");
        out.line("state[\"format_instructions\"] = \"Respond with a JSON object.\"");
    }
}

// User code from config.code replaces the default pass-through
@Component
class CustomTemplate extends BaseNodeTemplate {

    @Override public NodeCategory supportedCategory() { return NodeCategory.CUSTOM; }

    @Override
    public void writeBody(FlowNode node, CodeWriter out) {
        header(node, out, null);
        if (node.hasCustomCode()) {
            EmbeddedCode.write(node.configString("code"), out);
            return;
        }
        out.open("if \"input\" in state:");
        out.line("state[\"output\"] = f\"Processed: {state['input']}\"");
        out.dedent();
    }
}
