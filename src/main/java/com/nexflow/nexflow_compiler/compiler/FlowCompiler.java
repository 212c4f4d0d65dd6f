package com.nexflow.nexflow_compiler.compiler;

import com.nexflow.nexflow_compiler.analysis.FlowAnalyzer;
import com.nexflow.nexflow_compiler.analysis.FlowPlan;
import com.nexflow.nexflow_compiler.generator.GeneratedProgram;
import com.nexflow.nexflow_compiler.generator.PythonCodeGenerator;
import com.nexflow.nexflow_compiler.mapping.CategoryMapper;
import com.nexflow.nexflow_compiler.model.domain.FlowGraph;
import com.nexflow.nexflow_compiler.model.domain.FlowNode;
import com.nexflow.nexflow_compiler.parser.FlowGraphParser;
import com.nexflow.nexflow_compiler.schema.StateSchema;
import com.nexflow.nexflow_compiler.schema.StateSchemaSynthesizer;
import com.nexflow.nexflow_compiler.validator.CodeValidator;
import com.nexflow.nexflow_compiler.validator.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the pipeline for one flow, strictly in order:
 *
 *   parse → map categories → synthesize schema → analyze → generate → validate/fix
 *
 * Each stage gets only what the previous stages produced. The first failing stage throws
 * its typed {@link com.nexflow.nexflow_compiler.exception.ConversionException}; nothing
 * partial is returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowCompiler {

    private final FlowGraphParser parser;
    private final CategoryMapper mapper;
    private final StateSchemaSynthesizer schemaSynthesizer;
    private final FlowAnalyzer analyzer;
    private final PythonCodeGenerator generator;
    private final CodeValidator validator;

    public GeneratedArtifact compile(String exportJson, String fallbackName, boolean validate) {
        return compile(parser.parse(exportJson, fallbackName), validate);
    }

    public GeneratedArtifact compile(FlowGraph parsed, boolean validate) {
        FlowGraph graph = mapper.mapAll(parsed);
        StateSchema schema = schemaSynthesizer.synthesize(graph);
        FlowPlan plan = analyzer.analyze(graph, schema);
        GeneratedProgram program = generator.generate(graph, schema, plan);

        List<String> warnings = new ArrayList<>();
        graph.getNodes().stream()
                .map(FlowNode::getMappingWarning)
                .filter(w -> w != null)
                .forEach(warnings::add);
        warnings.addAll(plan.getWarnings());
        warnings.addAll(program.warnings());

        String text = program.text();
        if (validate) {
            ValidationReport report = validator.validate(text);
            text = report.text();
            warnings.addAll(report.warnings());
        }

        log.debug("Flow '{}': {} state fields, {} edges, {} branch point(s), {} loop(s)",
                graph.getName(), schema.size(), plan.getEdges().size(),
                plan.getBranchPoints().size(), plan.getLoops().size());

        return new GeneratedArtifact(
                graph.getName(),
                text,
                graph.nodeCount(),
                plan.hasLoops(),
                plan.hasBranches(),
                new ArrayList<>(schema.fieldNames()),
                warnings);
    }
}
