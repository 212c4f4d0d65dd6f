package com.nexflow.nexflow_compiler.service;

import com.nexflow.nexflow_compiler.ConversionStage;
import com.nexflow.nexflow_compiler.TestFlows;
import com.nexflow.nexflow_compiler.exception.ConversionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchConversionServiceTest {

    private final BatchConversionService batch = new BatchConversionService(
            new ConversionService(TestFlows.compiler()), TestFlows.PROPERTIES, Runnable::run);

    @TempDir
    Path dir;

    @Test
    void convertsEachFileIndependently() throws IOException {
        Path in = Files.createDirectories(dir.resolve("in"));
        Path out = dir.resolve("out");
        copy("linear_chain.json", in.resolve("a_linear.json"));
        copy("unknown_edge_endpoint.json", in.resolve("b_broken.json"));
        copy("router_no_default.json", in.resolve("c_router.json"));
        Files.writeString(in.resolve("notes.txt"), "not a flow", StandardCharsets.UTF_8);

        BatchConversionReport report = batch.convertDirectory(in, out, true);

        assertThat(report.total()).isEqualTo(3);
        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.entries()).extracting(BatchConversionReport.Entry::success).containsExactly(true, false, true);

        BatchConversionReport.Entry broken = report.entries().get(1);
        assertThat(broken.stage()).isEqualTo("PARSE");
        assertThat(broken.output()).isNull();
        assertThat(report.entries().get(2).warnings()).hasSize(1);

        assertThat(out.resolve("a_linear.py")).exists();
        assertThat(out.resolve("b_broken.py")).doesNotExist();
        assertThat(out.resolve("c_router.py")).exists();
    }

    @Test
    void outputNameSwapsSuffix() {
        assertThat(batch.outputFor(Path.of("flows/chat.json"), Path.of("gen")))
                .isEqualTo(Path.of("gen/chat.py"));
    }

    @Test
    void missingDirectoryFails() {
        assertThatThrownBy(() -> batch.convertDirectory(dir.resolve("nope"), dir, true))
                .isInstanceOf(ConversionException.class)
                .extracting(ex -> ((ConversionException) ex).getStage())
                .isEqualTo(ConversionStage.PARSE);
    }

    private static void copy(String fixture, Path target) throws IOException {
        Files.writeString(target, TestFlows.read(fixture), StandardCharsets.UTF_8);
    }
}
