package com.nexflow.nexflow_compiler;

import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.service.ConversionResult;
import com.nexflow.nexflow_compiler.service.ConversionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class NexflowCompilerApplicationTests {

    @Autowired
    private ConversionService conversionService;

    @Autowired
    private ConverterProperties properties;

    @Test
    void contextLoadsWithConfiguredDefaults() {
        assertThat(properties.indentUnit()).isEqualTo(4);
        assertThat(properties.defaultRouteField()).isEqualTo("route");
    }

    @Test
    void wiredPipelineConvertsFixture() {
        ConversionResult result = conversionService.convertContent(TestFlows.read("router_no_default.json"), null, true);

        assertThat(result.success()).isTrue();
        assertThat(result.artifact().text()).contains("def route_after_classify(state):");
    }
}
