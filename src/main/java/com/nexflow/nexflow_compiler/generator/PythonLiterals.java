package com.nexflow.nexflow_compiler.generator;

import java.math.BigDecimal;

/** Python literal rendering for values taken from node configuration. */
public final class PythonLiterals {

    private PythonLiterals() {}

    /** Double-quoted string literal with backslashes, quotes and control characters escaped. */
    public static String quote(String value) {
        if (value == null) return "None";
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"'  -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default   -> {
                    if (c < 0x20) out.append(String.format("\\x%02x", (int) c));
                    else out.append(c);
                }
            }
        }
        return out.append('"').toString();
    }

    /** Number literal when {@code value} parses as one, else {@code fallback}. */
    public static String number(Object value, String fallback) {
        if (value instanceof Number n) return n.toString();
        if (value == null) return fallback;
        try {
            return new BigDecimal(value.toString().trim()).toPlainString();
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    /** Text safe to put after '#' on a single line. */
    public static String comment(String value) {
        if (value == null) return "";
        return value.replaceAll("[\\r\\n]+", " ").trim();
    }
}
