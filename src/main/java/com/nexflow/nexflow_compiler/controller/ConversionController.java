package com.nexflow.nexflow_compiler.controller;

import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.model.dto.BatchConversionRequest;
import com.nexflow.nexflow_compiler.model.dto.ConversionResponse;
import com.nexflow.nexflow_compiler.service.BatchConversionReport;
import com.nexflow.nexflow_compiler.service.BatchConversionService;
import com.nexflow.nexflow_compiler.service.ConversionResult;
import com.nexflow.nexflow_compiler.service.ConversionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;

@RestController
@RequestMapping("/api/conversions")
@RequiredArgsConstructor
public class ConversionController {

    private final ConversionService conversionService;
    private final BatchConversionService batchConversionService;
    private final ConverterProperties properties;

    /** Body is the flow export itself; the generated program comes back in the response, nothing is written. */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConversionResponse> convert(@RequestBody String exportJson,
                                                      @RequestParam(required = false) Boolean validate) {
        ConversionResult result = conversionService.convertContent(exportJson, null, validateOrDefault(validate));
        if (!result.success()) throw result.error();
        return ResponseEntity.ok(ConversionResponse.from(result.artifact()));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchConversionReport> convertBatch(@RequestBody BatchConversionRequest request) {
        if (request == null || request.inputDir() == null || request.inputDir().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        Path inputDir = Path.of(request.inputDir());
        Path outputDir = request.outputDir() == null || request.outputDir().isBlank()
                ? inputDir
                : Path.of(request.outputDir());
        return ResponseEntity.ok(
                batchConversionService.convertDirectory(inputDir, outputDir, validateOrDefault(request.validate())));
    }

    private boolean validateOrDefault(Boolean validate) {
        return validate != null ? validate : properties.validateByDefault();
    }
}
