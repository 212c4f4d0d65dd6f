package com.nexflow.nexflow_compiler.generator;

import java.util.List;

/** Emitted program text plus the notes the generator made while emitting it. */
public record GeneratedProgram(String text, List<String> warnings) {

    public GeneratedProgram {
        warnings = List.copyOf(warnings);
    }
}
