package com.nexflow.nexflow_compiler.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nexflow.nexflow_compiler.analysis.ConditionExpression;
import com.nexflow.nexflow_compiler.exception.GraphParseException;
import com.nexflow.nexflow_compiler.model.domain.FieldSpec;
import com.nexflow.nexflow_compiler.model.domain.FieldType;
import com.nexflow.nexflow_compiler.model.domain.FlowEdge;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.model.domain.NodeRole;
import com.nexflow.nexflow_compiler.model.dto.FlowEdgeDto;
import com.nexflow.nexflow_compiler.model.dto.FlowExportDto;
import com.nexflow.nexflow_compiler.model.dto.FlowNodeDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw export text into a {@link FlowGraph}.
 *
 * Rejects (GraphParseException):
 *   - text that is not JSON, or a root that is not an object
 *   - a missing "nodes" or "edges" key
 *   - nodes without an id, duplicate ids, edges without source/target
 *   - edges or entry/finish marks that reference an unknown node id
 *   - declared fields whose name is not an identifier or whose type is unknown
 *   - edge conditions that cannot be tokenized
 *
 * A node without a declared type is kept; the category mapper turns it into Custom.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowGraphParser {

    public static final String DEFAULT_FLOW_NAME = "flow";
    private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";

    private final ObjectMapper objectMapper;

    public FlowGraph parse(String exportJson) {
        return parse(exportJson, DEFAULT_FLOW_NAME);
    }

    /** @param fallbackName flow name used when the export carries none (e.g. the file's base name) */
    public FlowGraph parse(String exportJson, String fallbackName) {
        JsonNode root = readTree(exportJson);
        requireArray(root, "nodes");
        requireArray(root, "edges");

        FlowExportDto dto;
        try {
            dto = objectMapper.treeToValue(root, FlowExportDto.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new GraphParseException("Invalid node/edge structure: " + ex.getMessage(), ex);
        }

        List<FlowNode> nodes = toNodes(dto.nodes());
        Set<String> ids = new HashSet<>();
        nodes.forEach(n -> ids.add(n.getId()));
        List<FlowEdge> edges = toEdges(dto.edges(), ids);

        String entry = blankToNull(dto.entry());
        if (entry != null && !ids.contains(entry)) {
            throw new GraphParseException("Entry mark references unknown node '" + entry + "'", List.of(entry));
        }
        List<String> finish = new ArrayList<>();
        for (String id : dto.finish()) {
            if (id == null || id.isBlank()) continue;
            if (!ids.contains(id)) {
                throw new GraphParseException("Finish mark references unknown node '" + id + "'", List.of(id));
            }
            if (!finish.contains(id)) finish.add(id);
        }

        String name = dto.name() != null && !dto.name().isBlank() ? dto.name().trim() : fallbackName;
        log.debug("Parsed flow '{}': {} nodes, {} edges", name, nodes.size(), edges.size());
        return new FlowGraph(name, nodes, edges, entry, finish);
    }

    // ── Raw tree checks ───────────────────────────────────────────────────────

    private JsonNode readTree(String exportJson) {
        if (exportJson == null || exportJson.isBlank()) {
            throw new GraphParseException("Export is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(exportJson);
        } catch (JsonProcessingException ex) {
            throw new GraphParseException("Invalid JSON syntax: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new GraphParseException("Invalid export: root must be a JSON object");
        }
        return root;
    }

    private void requireArray(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            throw new GraphParseException("Invalid export: '" + key + "' field is required");
        }
        if (!value.isArray()) {
            throw new GraphParseException("Invalid export: '" + key + "' must be a list");
        }
    }

    // ── Nodes ─────────────────────────────────────────────────────────────────

    private List<FlowNode> toNodes(List<FlowNodeDto> dtos) {
        List<FlowNode> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < dtos.size(); i++) {
            FlowNodeDto dto = dtos.get(i);
            if (dto == null || dto.id() == null || dto.id().isBlank()) {
                throw new GraphParseException("Node at position " + i + " has no id");
            }
            String id = dto.id().trim();
            if (!seen.add(id)) {
                throw new GraphParseException("Duplicate node id '" + id + "'", List.of(id));
            }
            nodes.add(toNode(id, dto));
        }
        return nodes;
    }

    private FlowNode toNode(String id, FlowNodeDto dto) {
        Map<String, Object> config = toConfig(dto);
        Object routeField = config.get("routeField");
        if (routeField != null && !routeField.toString().matches(IDENTIFIER)) {
            throw new GraphParseException("Node '" + id + "' has invalid routeField '" + routeField + "'", List.of(id));
        }
        return FlowNode.builder()
                .id(id)
                .declaredType(firstNonBlank(dto.type(), text(dto.data(), "type"), dto.classPath()))
                .label(firstNonBlank(dto.label(), text(dto.data(), "label")))
                .config(config)
                .declaredInputs(toFieldSpecs(id, dto.inputs()))
                .declaredOutputs(toFieldSpecs(id, dto.outputs()))
                .role(parseRole(dto.role()))
                .build();
    }

    // Langflow keeps configuration under "inputs"; an explicit "config" wins on clashes
    private Map<String, Object> toConfig(FlowNodeDto dto) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (dto.inputs() != null && dto.inputs().isObject()) {
            config.putAll(objectMapper.convertValue(dto.inputs(), new TypeReference<Map<String, Object>>() {}));
        }
        if (dto.config() != null) {
            config.putAll(dto.config());
        }
        config.values().removeIf(v -> v == null);
        return config;
    }

    private List<FieldSpec> toFieldSpecs(String nodeId, JsonNode declared) {
        if (declared == null || !declared.isArray()) return List.of();
        List<FieldSpec> specs = new ArrayList<>();
        for (JsonNode element : declared) {
            FieldSpec spec = toFieldSpec(nodeId, element);
            if (!specs.contains(spec)) specs.add(spec);
        }
        return specs;
    }

    private FieldSpec toFieldSpec(String nodeId, JsonNode element) {
        String name;
        FieldType type = null;
        if (element.isTextual()) {
            name = element.asText().trim();
        } else if (element.isObject() && element.hasNonNull("name")) {
            name = element.get("name").asText().trim();
            String typeName = text(element, "type");
            if (typeName != null) {
                type = FieldType.fromExportName(typeName);
                if (type == null) {
                    throw new GraphParseException("Node '" + nodeId + "' declares field '" + name
                            + "' with unknown type '" + typeName + "'", List.of(nodeId));
                }
            }
        } else {
            throw new GraphParseException("Node '" + nodeId + "' has a malformed field declaration: " + element,
                    List.of(nodeId));
        }
        if (!name.matches(IDENTIFIER)) {
            throw new GraphParseException("Node '" + nodeId + "' declares invalid field name '" + name
                    + "'. Use only letters, numbers, underscores, not starting with a number.", List.of(nodeId));
        }
        return FieldSpec.of(name, type);
    }

    private static NodeRole parseRole(String role) {
        if (role == null || role.isBlank()) return NodeRole.NONE;
        return switch (role.trim().toLowerCase(Locale.ROOT)) {
            case "input", "start", "entry"  -> NodeRole.ENTRY;
            case "output", "end", "finish"  -> NodeRole.FINISH;
            default                         -> NodeRole.NONE;
        };
    }

    // ── Edges ─────────────────────────────────────────────────────────────────

    private List<FlowEdge> toEdges(List<FlowEdgeDto> dtos, Set<String> nodeIds) {
        List<FlowEdge> edges = new ArrayList<>();
        for (int i = 0; i < dtos.size(); i++) {
            FlowEdgeDto dto = dtos.get(i);
            String source = dto != null ? blankToNull(dto.source()) : null;
            String target = dto != null ? blankToNull(dto.target()) : null;
            if (source == null || target == null) {
                throw new GraphParseException("Edge at position " + i + " needs both a source and a target");
            }
            if (!nodeIds.contains(source)) {
                throw new GraphParseException("Invalid edge: source node '" + source + "' not found",
                        List.of(source + "->" + target + "#" + i, source));
            }
            if (!nodeIds.contains(target)) {
                throw new GraphParseException("Invalid edge: target node '" + target + "' not found",
                        List.of(source + "->" + target + "#" + i, target));
            }
            String condition = firstNonBlank(dto.condition(), text(dto.data(), "condition"));
            if (condition != null) {
                checkCondition(condition, source + "->" + target + "#" + i);
            }
            edges.add(new FlowEdge(i, source, target, condition));
        }
        return edges;
    }

    private static void checkCondition(String condition, String edgeRef) {
        try {
            ConditionExpression.parse(condition);
        } catch (IllegalArgumentException ex) {
            throw new GraphParseException("Edge " + edgeRef + " has an unreadable condition: " + ex.getMessage(),
                    List.of(edgeRef));
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String text(JsonNode parent, String field) {
        if (parent == null || !parent.isObject()) return null;
        JsonNode value = parent.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value.trim();
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
