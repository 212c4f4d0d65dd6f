package com.nexflow.nexflow_compiler.validator;

import java.util.List;

/**
 * Program text after structural repair, plus one warning per repair (with its line number).
 * No warnings means the input was already well-formed and {@code text} equals it.
 */
public record ValidationReport(String text, List<String> warnings) {

    public ValidationReport {
        warnings = List.copyOf(warnings);
    }

    public boolean repaired() {
        return !warnings.isEmpty();
    }
}
