package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.generator.CodeWriter;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeCategory;

public interface NodeTemplate {

    NodeCategory supportedCategory();

    // Writes the statements of the node function; the caller emits the def line, docstring and `return state`
    void writeBody(FlowNode node, CodeWriter out);
}
