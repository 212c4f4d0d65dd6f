package com.nexflow.nexflow_compiler.config;

import com.nexflow.nexflow_compiler.service.BatchConversionReport;
import com.nexflow.nexflow_compiler.service.BatchConversionService;
import com.nexflow.nexflow_compiler.service.ConversionResult;
import com.nexflow.nexflow_compiler.service.ConversionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts from the command line when started with {@code --input=<file|dir>}.
 *
 * Options:
 *   --output=<file|dir>   target file (single input) or directory (batch); defaults next to the input
 *   --no-validate         skip the validator/fixer
 *
 * Without {@code --input} the application only serves the REST endpoints.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionCommandLineRunner implements ApplicationRunner {

    private final ConversionService conversionService;
    private final BatchConversionService batchConversionService;
    private final ConverterProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String input = option(args, "input");
        if (input == null) return;

        boolean validate = properties.validateByDefault() && !args.containsOption("no-validate");
        Path inputPath = Path.of(input);
        String output = option(args, "output");

        if (Files.isDirectory(inputPath)) {
            Path outputDir = output != null ? Path.of(output) : inputPath;
            BatchConversionReport report = batchConversionService.convertDirectory(inputPath, outputDir, validate);
            report.entries().stream()
                    .filter(e -> !e.success())
                    .forEach(e -> log.warn("  {} failed at {}: {}", e.input(), e.stage(), e.message()));
            return;
        }

        Path outputPath = output != null ? Path.of(output) : defaultOutput(inputPath);
        ConversionResult result = conversionService.convert(inputPath, outputPath, validate);
        if (result.success()) {
            result.artifact().warnings().forEach(w -> log.warn("  {}", w));
        }
    }

    private Path defaultOutput(Path input) {
        return input.resolveSibling(ConversionService.baseName(input) + properties.outputSuffix());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
