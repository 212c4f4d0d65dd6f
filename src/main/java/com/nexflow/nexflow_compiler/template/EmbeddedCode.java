package com.nexflow.nexflow_compiler.template;

import com.nexflow.nexflow_compiler.generator.CodeWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Places user code from a node's {@code config.code} inside the generated node function.
 *
 * Code that defines a top-level function is emitted as a nested def and then called with
 * the state; a dict result is merged into the state. Any other code runs as plain statements.
 */
final class EmbeddedCode {

    private static final Pattern TOP_LEVEL_DEF = Pattern.compile("^def\\s+([A-Za-z_]\\w*)\\s*\\(([^)]*)\\)");

    private EmbeddedCode() {}

    static void write(String code, CodeWriter out) {
        List<String> lines = normalize(code);
        lines.forEach(out::line);

        String function = null;
        String params = null;
        for (String line : lines) {
            Matcher m = TOP_LEVEL_DEF.matcher(line);
            if (m.find()) {
                function = m.group(1);
                params = m.group(2).trim();
            }
        }
        if (function == null) return;

        out.line("result = %s(%s)", function, params.isEmpty() ? "" : "state");
        out.open("if isinstance(result, dict):");
        out.line("state.update(result)");
        out.dedent();
    }

    /** Tabs expanded, surrounding blank lines dropped, common indentation removed. */
    static List<String> normalize(String code) {
        List<String> lines = new ArrayList<>();
        for (String raw : code.split("\\R", -1)) {
            lines.add(stripTrailing(raw.replace("\t", "    ")));
        }
        while (!lines.isEmpty() && lines.get(0).isBlank()) lines.remove(0);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) lines.remove(lines.size() - 1);

        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) continue;
            common = Math.min(common, leadingSpaces(line));
        }
        if (common == Integer.MAX_VALUE || common == 0) return lines;

        List<String> dedented = new ArrayList<>(lines.size());
        for (String line : lines) {
            dedented.add(line.isBlank() ? "" : line.substring(common));
        }
        return dedented;
    }

    private static int leadingSpaces(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') n++;
        return n;
    }

    private static String stripTrailing(String line) {
        return line.stripTrailing();
    }
}
