package com.nexflow.nexflow_compiler.mapping;

import com.nexflow.nexflow_compiler.model.domain.FieldContract;
import com.nexflow.nexflow_compiler.model.domain.FieldSpec;
import com.nexflow.nexflow_compiler.model.domain.FieldType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers the state fields a piece of user code touches, by text patterns only.
 *
 * Writes:  state["x"] = ...      return {"x": ...}
 * Reads:   state["x"]            state.get("x")          "x" in state
 *
 * A written field gets a type when its right-hand side starts with a literal
 * (string, number, bool, list, dict); otherwise it stays untyped.
 */
@Component
public class CustomCodeInspector {

    private static final Pattern ASSIGNMENT =
            Pattern.compile("state\\[\\s*[\"'](\\w+)[\"']\\s*]\\s*=(?!=)\\s*(.*)");
    private static final Pattern SUBSCRIPT_READ =
            Pattern.compile("state\\[\\s*[\"'](\\w+)[\"']\\s*]");
    private static final Pattern GET_READ =
            Pattern.compile("state\\.get\\(\\s*[\"'](\\w+)[\"']");
    private static final Pattern MEMBERSHIP_READ =
            Pattern.compile("[\"'](\\w+)[\"']\\s+(?:not\\s+)?in\\s+state\\b");
    private static final Pattern RETURN_DICT =
            Pattern.compile("return\\s*\\{(.*)}", Pattern.DOTALL);
    private static final Pattern DICT_KEY =
            Pattern.compile("[\"'](\\w+)[\"']\\s*:\\s*([^,}]*)");
    private static final Pattern NUMBER_LITERAL = Pattern.compile("-?\\d+(\\.\\d+)?\\b.*");

    public FieldContract inspect(String code) {
        if (code == null || code.isBlank()) return FieldContract.EMPTY;

        Map<String, FieldType> writes = new LinkedHashMap<>();
        Set<String> reads = new LinkedHashSet<>();

        for (String rawLine : code.split("\\R")) {
            String line = stripComment(rawLine);
            if (line.isBlank()) continue;

            Matcher assignment = ASSIGNMENT.matcher(line);
            if (assignment.find()) {
                recordWrite(writes, assignment.group(1), literalType(assignment.group(2)));
                // the right-hand side may still read other fields
                collectReads(assignment.group(2), reads);
                continue;
            }
            collectReads(line, reads);
        }

        Matcher returned = RETURN_DICT.matcher(code);
        while (returned.find()) {
            Matcher key = DICT_KEY.matcher(returned.group(1));
            while (key.find()) {
                recordWrite(writes, key.group(1), literalType(key.group(2)));
            }
        }

        List<FieldSpec> readSpecs = new ArrayList<>();
        reads.stream().filter(CustomCodeInspector::isIdentifier).forEach(name -> readSpecs.add(FieldSpec.untyped(name)));
        List<FieldSpec> writeSpecs = new ArrayList<>();
        writes.forEach((name, type) -> {
            if (isIdentifier(name)) writeSpecs.add(FieldSpec.of(name, type));
        });
        return FieldContract.of(readSpecs, writeSpecs);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static void collectReads(String text, Set<String> reads) {
        for (Pattern pattern : List.of(SUBSCRIPT_READ, GET_READ, MEMBERSHIP_READ)) {
            Matcher m = pattern.matcher(text);
            while (m.find()) reads.add(m.group(1));
        }
    }

    // First typed write wins; a later untyped write never erases a known type
    private static void recordWrite(Map<String, FieldType> writes, String name, FieldType type) {
        FieldType existing = writes.get(name);
        if (existing == null) writes.put(name, type);
    }

    static FieldType literalType(String expression) {
        if (expression == null) return null;
        String expr = expression.trim();
        if (expr.isEmpty()) return null;
        char first = expr.charAt(0);
        if (first == '"' || first == '\'') return FieldType.TEXT;
        if ((first == 'f' || first == 'r') && expr.length() > 1 && (expr.charAt(1) == '"' || expr.charAt(1) == '\'')) {
            return FieldType.TEXT;
        }
        if (first == '[') return FieldType.LIST;
        if (first == '{') return FieldType.MAPPING;
        if (expr.startsWith("True") || expr.startsWith("False")) return FieldType.BOOLEAN;
        if (NUMBER_LITERAL.matcher(expr).matches()) return FieldType.NUMBER;
        if (expr.startsWith("str(")) return FieldType.TEXT;
        return null;
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        if (hash < 0) return line;
        // only strip when the '#' is outside a string literal
        int quotes = 0;
        for (int i = 0; i < hash; i++) {
            char c = line.charAt(i);
            if (c == '"' || c == '\'') quotes++;
        }
        return quotes % 2 == 0 ? line.substring(0, hash) : line;
    }

    private static boolean isIdentifier(String name) {
        return !name.isEmpty() && !Character.isDigit(name.charAt(0));
    }
}
