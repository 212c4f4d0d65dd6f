package com.nexflow.nexflow_compiler.config;

import com.nexflow.nexflow_compiler.model.domain.FlowNode;

/**
 * Converter settings, bound from the {@code converter.*} properties by {@link ConverterConfig}.
 *
 * @param indentUnit        spaces per nesting level in the emitted program
 * @param validateByDefault whether conversions run the validator when the caller does not say
 * @param outputSuffix      extension of written programs
 * @param inputSuffix       extension of export files picked up by batch runs
 * @param batchParallelism  worker threads for batch runs
 * @param defaultRouteField state field compared against bare route literals
 */
public record ConverterProperties(
    int indentUnit,
    boolean validateByDefault,
    String outputSuffix,
    String inputSuffix,
    int batchParallelism,
    String defaultRouteField
) {
    public ConverterProperties {
        if (indentUnit < 1) {
            throw new IllegalArgumentException("converter.indent-unit must be positive, got " + indentUnit);
        }
        if (batchParallelism < 1) {
            throw new IllegalArgumentException("converter.batch.parallelism must be positive, got " + batchParallelism);
        }
    }

    public static ConverterProperties defaults() {
        return new ConverterProperties(4, true, ".py", ".json", 4, "route");
    }

    /** Route field of a branching node: its {@code routeField} config entry, else the default. */
    public String routeFieldOf(FlowNode node) {
        return node.configString("routeField", defaultRouteField);
    }

    public String indentString() {
        return " ".repeat(indentUnit);
    }
}
