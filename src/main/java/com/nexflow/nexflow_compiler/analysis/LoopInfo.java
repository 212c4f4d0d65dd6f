package com.nexflow.nexflow_compiler.analysis;

import com.nexflow.nexflow_compiler.model.domain.FlowEdge;

import java.util.List;

/**
 * Cycle closed by a back-edge.
 *
 * @param bodyIds    nodes on some path from the back-edge target to its source, in visit order
 * @param deciderIds branching nodes in the body; at least one
 * @param exitFields fields the deciders read that other body nodes write
 */
public record LoopInfo(FlowEdge backEdge, List<String> bodyIds, List<String> deciderIds, List<String> exitFields) {

    public LoopInfo {
        bodyIds = List.copyOf(bodyIds);
        deciderIds = List.copyOf(deciderIds);
        exitFields = List.copyOf(exitFields);
    }
}
