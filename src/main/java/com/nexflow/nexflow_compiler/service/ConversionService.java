package com.nexflow.nexflow_compiler.service;

import com.nexflow.nexflow_compiler.ConversionStage;
import com.nexflow.nexflow_compiler.compiler.FlowCompiler;
import com.nexflow.nexflow_compiler.compiler.GeneratedArtifact;
import com.nexflow.nexflow_compiler.exception.ConversionException;
import com.nexflow.nexflow_compiler.parser.FlowGraphParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point for converting one flow export.
 *
 * The output file is written only after the whole pipeline succeeded; a failed
 * conversion leaves the output path untouched. Failures are returned, not thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionService {

    private final FlowCompiler compiler;

    public ConversionResult convert(Path input, Path output, boolean validate) {
        String content;
        try {
            content = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return failed(new ConversionException(ConversionStage.PARSE,
                    "Cannot read flow export " + input + ": " + ex.getMessage(), ex), input.toString());
        }
        return convertContent(content, baseName(input), output, validate);
    }

    public ConversionResult convertContent(String exportJson, Path output, boolean validate) {
        return convertContent(exportJson, FlowGraphParser.DEFAULT_FLOW_NAME, output, validate);
    }

    private ConversionResult convertContent(String exportJson, String fallbackName, Path output, boolean validate) {
        GeneratedArtifact artifact;
        try {
            artifact = compiler.compile(exportJson, fallbackName, validate);
        } catch (ConversionException ex) {
            return failed(ex, fallbackName);
        }

        if (output != null) {
            try {
                write(output, artifact.text());
            } catch (IOException ex) {
                return failed(new ConversionException(ConversionStage.OUTPUT,
                        "Cannot write " + output + ": " + ex.getMessage(), ex), artifact.flowName());
            }
        }

        log.info("Converted flow '{}' ({} nodes, {} warnings){}", artifact.flowName(), artifact.nodeCount(),
                artifact.warnings().size(), output != null ? " → " + output : "");
        return ConversionResult.ok(artifact, output);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static void write(Path output, String text) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(output, text, StandardCharsets.UTF_8);
    }

    private static ConversionResult failed(ConversionException ex, String source) {
        log.warn("Conversion of {} failed at {}: {} (ids: {})", source, ex.getStage(), ex.getMessage(), ex.getOffendingIds());
        return ConversionResult.failure(ex);
    }

    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
