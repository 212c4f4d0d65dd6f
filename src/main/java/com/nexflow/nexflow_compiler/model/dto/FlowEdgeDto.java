package com.nexflow.nexflow_compiler.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One exported edge. The routing condition may sit at the top level or under
 * "data.condition" (Langflow exports).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowEdgeDto(
    @JsonAlias("sourceNodeId")
    String source,
    @JsonAlias("targetNodeId")
    String target,
    @JsonAlias("conditionExpr")
    String condition,
    JsonNode data
) {}
