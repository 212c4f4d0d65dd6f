package com.nexflow.nexflow_compiler.model.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * Root of a flow export. Null-safe: null lists are treated as empty. Whether
 * "nodes"/"edges" were present at all is checked by the parser on the raw tree.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowExportDto(
    String name,
    List<FlowNodeDto> nodes,
    List<FlowEdgeDto> edges,
    String entry,
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    List<String> finish
) {
    public List<FlowNodeDto> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public List<FlowEdgeDto> edges() {
        return edges != null ? edges : Collections.emptyList();
    }

    public List<String> finish() {
        return finish != null ? finish : Collections.emptyList();
    }
}
