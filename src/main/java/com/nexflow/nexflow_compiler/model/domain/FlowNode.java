package com.nexflow.nexflow_compiler.model.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One node of a parsed flow. Created by the parser, completed once by the category
 * mapper (category, effective contract, mapping warning) and never changed afterwards.
 */
@Value
@Builder(toBuilder = true)
public class FlowNode {

    String id;

    // Type name as written in the export, e.g. "LLM", "ChatOpenAI", "langchain.agents.agent.AgentExecutor"
    String declaredType;

    String label;

    // Null until the category mapper has run
    NodeCategory category;

    @Singular("configEntry")
    Map<String, Object> config;

    @Singular
    List<FieldSpec> declaredInputs;

    @Singular
    List<FieldSpec> declaredOutputs;

    @Builder.Default
    NodeRole role = NodeRole.NONE;

    // Category contract plus declared fields plus fields inferred from custom code
    @Builder.Default
    FieldContract contract = FieldContract.EMPTY;

    // Set when the declared type was not recognised and the node fell back to Custom
    String mappingWarning;

    public boolean isRouter() {
        return category != null && category.isRouter();
    }

    public String configString(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }

    public String configString(String key, String fallback) {
        String value = configString(key);
        return value != null && !value.isBlank() ? value : fallback;
    }

    public boolean hasCustomCode() {
        String code = configString("code");
        return code != null && !code.isBlank();
    }

    public String displayLabel() {
        return label != null && !label.isBlank() ? label : id;
    }
}
