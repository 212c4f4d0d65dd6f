package com.nexflow.nexflow_compiler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
public class ConverterConfig {

    @Value("${converter.indent-unit:4}")
    private int indentUnit;

    @Value("${converter.validate-by-default:true}")
    private boolean validateByDefault;

    @Value("${converter.output-suffix:.py}")
    private String outputSuffix;

    @Value("${converter.input-suffix:.json}")
    private String inputSuffix;

    @Value("${converter.batch.parallelism:4}")
    private int batchParallelism;

    @Value("${converter.default-route-field:route}")
    private String defaultRouteField;

    @Bean
    public ConverterProperties converterProperties() {
        ConverterProperties properties = new ConverterProperties(
                indentUnit, validateByDefault, outputSuffix, inputSuffix, batchParallelism, defaultRouteField);
        log.info("Converter settings: {}", properties);
        return properties;
    }

    /** Runs batch conversions, one file per task. */
    @Bean(name = "conversionExecutor")
    public ThreadPoolTaskExecutor conversionExecutor(ConverterProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.batchParallelism());
        executor.setMaxPoolSize(properties.batchParallelism());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("convert-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
