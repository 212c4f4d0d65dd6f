package com.nexflow.nexflow_compiler.controller;

import com.nexflow.nexflow_compiler.ConversionStage;
import com.nexflow.nexflow_compiler.exception.ConversionException;
import com.nexflow.nexflow_compiler.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps conversion failures to HTTP responses.
 *
 * Bad input (parse, schema, structure) is the caller's problem: 400. A program that fails
 * validation, or an output that cannot be written, is ours: 500.
 */
@Slf4j
@RestControllerAdvice
public class ConversionExceptionHandler {

    @ExceptionHandler(ConversionException.class)
    public ResponseEntity<ErrorResponse> handleConversion(ConversionException ex) {
        HttpStatus status = statusOf(ex.getStage());
        if (status.is5xxServerError()) {
            log.error("Conversion failed at {}: {}", ex.getStage(), ex.getMessage());
        } else {
            log.warn("Rejected flow at {}: {}", ex.getStage(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.getStage().name(), ex.getMessage(), ex.getOffendingIds()));
    }

    static HttpStatus statusOf(ConversionStage stage) {
        return switch (stage) {
            case PARSE, MAPPING, SCHEMA, ANALYSIS -> HttpStatus.BAD_REQUEST;
            case GENERATION, VALIDATION, OUTPUT   -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
