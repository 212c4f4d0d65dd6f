package com.nexflow.nexflow_compiler.generator;

/**
 * Line-oriented text builder that tracks the nesting depth itself, so emitted
 * Python is indented correctly by construction.
 */
public class CodeWriter {

    private final StringBuilder text = new StringBuilder();
    private final String unit;
    private int depth;

    public CodeWriter(String unit) {
        this.unit = unit;
    }

    public CodeWriter line(String content) {
        if (content.isEmpty()) return blankLine();
        text.append(unit.repeat(depth)).append(content).append('\n');
        return this;
    }

    public CodeWriter line(String format, Object... args) {
        return line(String.format(format, args));
    }

    public CodeWriter blankLine() {
        text.append('\n');
        return this;
    }

    /** Emits {@code header} (which must end in ':') and opens a block below it. */
    public CodeWriter open(String header) {
        line(header);
        return indent();
    }

    public CodeWriter indent() {
        depth++;
        return this;
    }

    public CodeWriter dedent() {
        if (depth == 0) {
            throw new IllegalStateException("dedent below column 0");
        }
        depth--;
        return this;
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
