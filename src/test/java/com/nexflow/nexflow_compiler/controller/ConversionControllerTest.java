package com.nexflow.nexflow_compiler.controller;

import com.nexflow.nexflow_compiler.ConversionStage;
import com.nexflow.nexflow_compiler.TestFlows;
import com.nexflow.nexflow_compiler.service.BatchConversionService;
import com.nexflow.nexflow_compiler.service.ConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ConversionControllerTest {

    private MockMvc mockMvc;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        ConversionService conversionService = new ConversionService(TestFlows.compiler());
        BatchConversionService batchService =
                new BatchConversionService(conversionService, TestFlows.PROPERTIES, Runnable::run);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ConversionController(conversionService, batchService, TestFlows.PROPERTIES))
                .setControllerAdvice(new ConversionExceptionHandler())
                .build();
    }

    @Test
    void convertsPostedExport() throws Exception {
        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestFlows.read("linear_chain.json")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flowName").value("Linear Chain"))
                .andExpect(jsonPath("$.nodeCount").value(4))
                .andExpect(jsonPath("$.hasLoops").value(false))
                .andExpect(jsonPath("$.code").value(containsString("def create_graph():")))
                .andExpect(jsonPath("$.stateFields").value(hasItem("llm_response")));
    }

    @Test
    void malformedExportIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/conversions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestFlows.read("unknown_edge_endpoint.json")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.stage").value("PARSE"))
                .andExpect(jsonPath("$.message").value(containsString("ghost")))
                .andExpect(jsonPath("$.offendingIds").value(hasItem("ghost")));
    }

    @Test
    void structuralErrorIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/conversions")
                        .param("validate", "false")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestFlows.read("loop_without_update.json")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.stage").value("ANALYSIS"))
                .andExpect(jsonPath("$.offendingIds[0]").value("check->work#2"));
    }

    @Test
    void batchConvertsDirectory() throws Exception {
        Files.writeString(dir.resolve("chain.json"), TestFlows.read("linear_chain.json"), StandardCharsets.UTF_8);

        mockMvc.perform(post("/api/conversions/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"inputDir\": \"" + escaped(dir) + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.succeeded").value(1));

        assertThat(dir.resolve("chain.py")).exists();
    }

    @Test
    void batchWithoutInputDirIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/conversions/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outputDir\": \"out\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void stagesMapToStatus() {
        assertThat(ConversionExceptionHandler.statusOf(ConversionStage.SCHEMA)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ConversionExceptionHandler.statusOf(ConversionStage.VALIDATION))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(ConversionExceptionHandler.statusOf(ConversionStage.OUTPUT))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static String escaped(Path path) {
        return path.toAbsolutePath().toString().replace("\\", "\\\\");
    }
}
