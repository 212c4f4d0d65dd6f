package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.generator.CodeWriter;
import com.nexflow.nexflow_compiler.generator.PythonLiterals;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;

/** Helpers shared by the category templates. */
abstract class BaseNodeTemplate implements NodeTemplate {

    // Last segment of the declared type ("langchain.llms.openai.OpenAI" -> "OpenAI"), else the category name
    protected String typeName(FlowNode node) {
        String declared = node.getDeclaredType();
        if (declared == null || declared.isBlank()) return supportedCategory().displayName();
        return declared.substring(declared.lastIndexOf('.') + 1).trim();
    }

    protected void header(FlowNode node, CodeWriter out, String detail) {
        String line = "# " + supportedCategory().displayName() + ": " + PythonLiterals.comment(typeName(node));
        out.line(detail == null || detail.isBlank() ? line : line + " (" + PythonLiterals.comment(detail) + ")");
    }

    protected String number(FlowNode node, String key, String fallback) {
        return PythonLiterals.number(node.getConfig().get(key), fallback);
    }
}
