package com.nexflow.nexflow_compiler.service;

import com.nexflow.nexflow_compiler.ConversionStage;
import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.exception.ConversionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Converts every export in a directory. Each file runs its own pipeline on the
 * conversion executor; files share nothing, and one failure does not stop the others.
 *
 * Output for {@code <inputDir>/<name>.json} is {@code <outputDir>/<name>.py}
 * (suffixes from {@link ConverterProperties}).
 */
@Slf4j
@Service
public class BatchConversionService {

    private final ConversionService conversionService;
    private final ConverterProperties properties;
    private final Executor executor;

    public BatchConversionService(ConversionService conversionService, ConverterProperties properties,
                                  @Qualifier("conversionExecutor") Executor executor) {
        this.conversionService = conversionService;
        this.properties = properties;
        this.executor = executor;
    }

    public BatchConversionReport convertDirectory(Path inputDir, Path outputDir, boolean validate) {
        List<Path> inputs = listInputs(inputDir);
        log.info("Batch conversion of {} file(s) from {} to {}", inputs.size(), inputDir, outputDir);

        List<CompletableFuture<BatchConversionReport.Entry>> futures = inputs.stream()
                .map(input -> CompletableFuture.supplyAsync(() -> convertOne(input, outputDir, validate), executor))
                .toList();

        List<BatchConversionReport.Entry> entries = futures.stream().map(CompletableFuture::join).toList();
        BatchConversionReport report = BatchConversionReport.of(entries);
        log.info("Batch finished: {} succeeded, {} failed", report.succeeded(), report.failed());
        return report;
    }

    Path outputFor(Path input, Path outputDir) {
        return outputDir.resolve(ConversionService.baseName(input) + properties.outputSuffix());
    }

    private BatchConversionReport.Entry convertOne(Path input, Path outputDir, boolean validate) {
        Path output = outputFor(input, outputDir);
        ConversionResult result = conversionService.convert(input, output, validate);
        if (result.success()) {
            return new BatchConversionReport.Entry(input.toString(), output.toString(), true, null, null,
                    result.artifact().warnings());
        }
        ConversionException error = result.error();
        return new BatchConversionReport.Entry(input.toString(), null, false, error.getStage().name(),
                error.getMessage(), List.of());
    }

    private List<Path> listInputs(Path inputDir) {
        if (!Files.isDirectory(inputDir)) {
            throw new ConversionException(ConversionStage.PARSE, "Not a directory: " + inputDir, List.of());
        }
        try (Stream<Path> files = Files.list(inputDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(f -> f.getFileName().toString().endsWith(properties.inputSuffix()))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new ConversionException(ConversionStage.PARSE, "Cannot list " + inputDir + ": " + ex.getMessage(), ex);
        }
    }
}
