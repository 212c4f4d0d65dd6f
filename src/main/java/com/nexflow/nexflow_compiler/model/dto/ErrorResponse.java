package com.nexflow.nexflow_compiler.model.dto;

import java.util.List;

/** Body of every failed conversion request. */
public record ErrorResponse(String stage, String message, List<String> offendingIds) {}
