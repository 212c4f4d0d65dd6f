package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.model.domain.NodeCategory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class NodeTemplateRegistry {

    private final List<NodeTemplate> templates;
    private final Map<NodeCategory, NodeTemplate> registry = new EnumMap<>(NodeCategory.class);

    // Fails start-up unless every category has exactly one template
    @PostConstruct
    public void init() {
        templates.forEach(template -> {
            NodeTemplate previous = registry.put(template.supportedCategory(), template);
            if (previous != null) {
                throw new IllegalStateException("Two templates registered for category " + template.supportedCategory()
                        + ": " + previous.getClass().getSimpleName() + ", " + template.getClass().getSimpleName());
            }
        });
        Set<NodeCategory> missing = EnumSet.allOf(NodeCategory.class);
        missing.removeAll(registry.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No template registered for categories: " + missing);
        }
    }

    public NodeTemplate get(NodeCategory category) {
        NodeTemplate template = registry.get(category);
        if (template == null) {
            throw new UnsupportedOperationException("No template registered for node category: " + category);
        }
        return template;
    }
}
