package com.nexflow.nexflow_compiler.config;

import com.nexflow.nexflow_compiler.TestFlows;
import com.nexflow.nexflow_compiler.service.BatchConversionService;
import com.nexflow.nexflow_compiler.service.ConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionCommandLineRunnerTest {

    private ConversionCommandLineRunner runner;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        ConversionService conversionService = new ConversionService(TestFlows.compiler());
        runner = new ConversionCommandLineRunner(conversionService,
                new BatchConversionService(conversionService, TestFlows.PROPERTIES, Runnable::run),
                TestFlows.PROPERTIES);
    }

    @Test
    void singleFileDefaultsOutputNextToInput() throws IOException {
        Path input = write("chain.json", "linear_chain.json");

        runner.run(new DefaultApplicationArguments("--input=" + input));

        assertThat(dir.resolve("chain.py")).exists();
    }

    @Test
    void directoryInputRunsBatchIntoOutputDir() throws IOException {
        write("router.json", "router_no_default.json");
        write("loop.json", "loop_counter.json");
        Path out = dir.resolve("generated");

        runner.run(new DefaultApplicationArguments("--input=" + dir, "--output=" + out, "--no-validate"));

        assertThat(out.resolve("router.py")).exists();
        assertThat(out.resolve("loop.py")).exists();
    }

    @Test
    void withoutInputDoesNothing() throws IOException {
        write("chain.json", "linear_chain.json");

        runner.run(new DefaultApplicationArguments("--server.port=0"));

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).hasSize(1);
        }
    }

    private Path write(String name, String fixture) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, TestFlows.read(fixture), StandardCharsets.UTF_8);
        return file;
    }
}
