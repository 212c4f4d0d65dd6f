package com.nexflow.nexflow_compiler.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * One exported node. Accepts both the flat shape ({id, type, config, inputs, outputs})
 * and the Langflow shape ({id, data: {type, label}, class_path, inputs: {...config}}),
 * which is why inputs/outputs/data stay as raw JSON here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowNodeDto(
    String id,
    @JsonAlias("nodeType")
    String type,
    String label,
    Map<String, Object> config,
    JsonNode inputs,
    JsonNode outputs,
    String role,
    JsonNode data,
    @JsonAlias({"class_path", "classPath"})
    String classPath
) {}
