package com.nexflow.nexflow_compiler.model.dto;

/** validate == null means the configured default. */
public record BatchConversionRequest(String inputDir, String outputDir, Boolean validate) {}
