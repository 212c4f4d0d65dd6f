package com.nexflow.nexflow_compiler.service;

import com.nexflow.nexflow_compiler.compiler.GeneratedArtifact;
import com.nexflow.nexflow_compiler.exception.ConversionException;

import java.nio.file.Path;

/**
 * Outcome of one conversion. On success {@code artifact} is set and {@code outputPath} names the
 * written file (null when no output was requested); on failure only {@code error} is set.
 */
public record ConversionResult(boolean success, GeneratedArtifact artifact, Path outputPath,
                               ConversionException error) {

    static ConversionResult ok(GeneratedArtifact artifact, Path outputPath) {
        return new ConversionResult(true, artifact, outputPath, null);
    }

    static ConversionResult failure(ConversionException error) {
        return new ConversionResult(false, null, null, error);
    }
}
