package com.nexflow.nexflow_compiler.schema;

import com.nexflow.nexflow_compiler.analysis.ConditionExpression;
import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.exception.SchemaConflictException;
import com.nexflow.nexflow_compiler.model.domain.FieldSpec;
import com.nexflow.nexflow_compiler.model.domain.FieldType;
import com.nexflow.nexflow_compiler.model.domain.FlowEdge;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unions the effective contracts of all nodes (graph order, reads before writes), then
 * the fields referenced by edge conditions (edge order). Every type tag a field receives
 * is collected first and joined once, so the outcome does not depend on node order.
 * Untyped fields adopt the type the rest of the flow gives them, else text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateSchemaSynthesizer {

    private final ConverterProperties properties;

    public StateSchema synthesize(FlowGraph graph) {
        Map<String, List<Tag>> tags = new LinkedHashMap<>();
        Map<String, List<String>> contributors = new LinkedHashMap<>();

        for (FlowNode node : graph.getNodes()) {
            node.getContract().reads().forEach(spec -> add(tags, contributors, spec, node.getId()));
            node.getContract().writes().forEach(spec -> add(tags, contributors, spec, node.getId()));
        }

        for (FlowEdge edge : graph.getEdges()) {
            if (!edge.isConditioned()) continue;
            String routeField = properties.routeFieldOf(graph.node(edge.sourceId()));
            ConditionExpression condition = ConditionExpression.parse(edge.condition());
            condition.referencedFields(routeField)
                    .forEach(spec -> add(tags, contributors, spec, edge.sourceId()));
        }

        Map<String, FieldType> types = new LinkedHashMap<>();
        tags.forEach((name, fieldTags) -> types.put(name, resolve(name, fieldTags)));
        log.debug("State schema of '{}': {} fields {}", graph.getName(), types.size(), types.keySet());
        return new StateSchema(types, contributors);
    }

    private record Tag(FieldType type, String nodeId) {}

    private static void add(Map<String, List<Tag>> tags, Map<String, List<String>> contributors,
                            FieldSpec spec, String nodeId) {
        List<Tag> fieldTags = tags.computeIfAbsent(spec.name(), k -> new ArrayList<>());
        if (spec.isTyped()) fieldTags.add(new Tag(spec.type(), nodeId));
        List<String> ids = contributors.computeIfAbsent(spec.name(), k -> new ArrayList<>());
        if (!ids.contains(nodeId)) ids.add(nodeId);
    }

    private static FieldType resolve(String name, List<Tag> fieldTags) {
        if (fieldTags.isEmpty()) return FieldType.TEXT;
        Optional<FieldType> joined = FieldType.join(fieldTags.stream().map(Tag::type).toList());
        if (joined.isPresent()) return joined.get();

        // report the first tag that cannot sit next to an earlier one, against every node giving that earlier type
        for (int later = 1; later < fieldTags.size(); later++) {
            Tag conflicting = fieldTags.get(later);
            for (int earlier = 0; earlier < later; earlier++) {
                FieldType existing = fieldTags.get(earlier).type();
                if (existing.mergeWith(conflicting.type()).isEmpty()) {
                    List<String> existingIds = fieldTags.subList(0, later).stream()
                            .filter(tag -> tag.type() == existing)
                            .map(Tag::nodeId)
                            .distinct()
                            .toList();
                    throw new SchemaConflictException(name, existing, existingIds, conflicting.type(), conflicting.nodeId());
                }
            }
        }
        throw new IllegalStateException("Field '" + name + "' has no joinable type but no conflicting pair");
    }
}
