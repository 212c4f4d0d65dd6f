package com.nexflow.nexflow_compiler.analysis;

import com.nexflow.nexflow_compiler.generator.PythonLiterals;
import com.nexflow.nexflow_compiler.model.domain.FieldSpec;
import com.nexflow.nexflow_compiler.model.domain.FieldType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed routing condition of an edge.
 *
 * Three shapes:
 *   DEFAULT    "default", "else", "otherwise"
 *   VALUE      a bare literal ("positive", 'positive', 42) compared against the source's route
 *              field, or "field == literal"
 *   PREDICATE  any other boolean expression, e.g. "score >= 0.5 && !done"
 *
 * Bare identifiers in a predicate are state fields and become {@code state.get("name")}; explicit
 * lookups ({@code state["x"]}, {@code state.x}, {@code state.get("x")}, {@code state.get("x", default)})
 * name the same field and keep their default. {@code state} alone is the state mapping, never a field.
 * {@code &&}, {@code ||}, {@code !}, true/false/null are translated to Python.
 */
public final class ConditionExpression {

    public enum Kind { DEFAULT, VALUE, PREDICATE }

    private static final Set<String> DEFAULT_WORDS = Set.of("default", "else", "otherwise");
    private static final Set<String> PYTHON_WORDS = Set.of("and", "or", "not", "in", "is", "None", "True", "False");
    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final String BARE_LITERAL = "[A-Za-z0-9_\\-]+";

    private final String source;
    private final Kind kind;
    // VALUE: compared field, null when the route field of the source node applies
    private final String field;
    private final Literal literal;
    // PREDICATE: translated expression and referenced fields with inferred types (null = unknown)
    private final String python;
    private final Map<String, FieldType> predicateFields;

    private ConditionExpression(String source, Kind kind, String field, Literal literal,
                                String python, Map<String, FieldType> predicateFields) {
        this.source = source;
        this.kind = kind;
        this.field = field;
        this.literal = literal;
        this.python = python;
        this.predicateFields = predicateFields;
    }

    /**
     * @throws IllegalArgumentException when the text cannot be tokenized (e.g. an unterminated string)
     */
    public static ConditionExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Condition is empty");
        }
        String trimmed = text.trim();
        if (DEFAULT_WORDS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return new ConditionExpression(trimmed, Kind.DEFAULT, null, null, null, Map.of());
        }

        List<Token> tokens = tokenize(trimmed);
        if (tokens.size() == 1 && tokens.get(0).isLiteral()) {
            return value(trimmed, null, Literal.of(tokens.get(0)));
        }
        if (trimmed.matches(BARE_LITERAL) && !PYTHON_WORDS.contains(trimmed)) {
            return value(trimmed, null, new Literal(trimmed, PythonLiterals.quote(trimmed), FieldType.TEXT));
        }

        ConditionExpression equality = tryEquality(trimmed, tokens);
        if (equality != null) return equality;

        return translatePredicate(trimmed, tokens);
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public String source() {
        return source;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isDefault() {
        return kind == Kind.DEFAULT;
    }

    /** Field a VALUE condition compares; the given route field when the condition is a bare literal. */
    public String valueField(String routeField) {
        return field != null ? field : routeField;
    }

    /** Route key of a VALUE condition (the literal's text, unquoted); null otherwise. */
    public String routeKey() {
        return literal != null ? literal.text() : null;
    }

    /** Python boolean expression over {@code state}. */
    public String toPython(String routeField) {
        return switch (kind) {
            case DEFAULT   -> "True";
            case VALUE     -> "state.get(" + PythonLiterals.quote(valueField(routeField)) + ") == " + literal.python();
            case PREDICATE -> python;
        };
    }

    /** State fields the condition reads, typed from the compared literal where one is known. */
    public List<FieldSpec> referencedFields(String routeField) {
        return switch (kind) {
            case DEFAULT   -> List.of();
            case VALUE     -> List.of(FieldSpec.of(valueField(routeField), literal.type()));
            case PREDICATE -> {
                List<FieldSpec> specs = new ArrayList<>();
                predicateFields.forEach((name, type) -> specs.add(FieldSpec.of(name, type)));
                yield specs;
            }
        };
    }

    @Override
    public String toString() {
        return kind + "(" + source + ")";
    }

    // ── Parsing ───────────────────────────────────────────────────────────────

    private static ConditionExpression value(String source, String field, Literal literal) {
        return new ConditionExpression(source, Kind.VALUE, field, literal, null, Map.of());
    }

    // field == literal, literal == field
    private static ConditionExpression tryEquality(String source, List<Token> tokens) {
        int eq = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is("==")) {
                if (eq >= 0) return null;
                eq = i;
            }
        }
        if (eq < 0) return null;
        List<Token> left = tokens.subList(0, eq);
        List<Token> right = tokens.subList(eq + 1, tokens.size());

        String leftField = fieldReference(left);
        if (leftField != null && right.size() == 1 && right.get(0).isLiteral()) {
            return value(source, leftField, Literal.of(right.get(0)));
        }
        String rightField = fieldReference(right);
        if (rightField != null && left.size() == 1 && left.get(0).isLiteral()) {
            return value(source, rightField, Literal.of(left.get(0)));
        }
        return null;
    }

    // x | state.x | state["x"] | state.get("x"); state.get("x", default) is left to the predicate path
    private static String fieldReference(List<Token> tokens) {
        if (tokens.size() == 1 && tokens.get(0).type == TokenType.IDENT && isFieldName(tokens.get(0).text)) {
            return tokens.get(0).text;
        }
        FieldRef ref = stateReference(tokens, 0);
        return ref != null && ref.end == tokens.size() && ref.fallback == null ? ref.name : null;
    }

    // fallback: rendered Python default of state.get("x", default), null when absent
    private record FieldRef(String name, int end, String fallback) {}

    private static FieldRef stateReference(List<Token> tokens, int at) {
        if (at >= tokens.size() || !tokens.get(at).is("state")) return null;
        if (matches(tokens, at + 1, "[") && at + 3 < tokens.size()
                && tokens.get(at + 2).type == TokenType.STRING && tokens.get(at + 3).is("]")) {
            return new FieldRef(tokens.get(at + 2).value, at + 4, null);
        }
        if (matches(tokens, at + 1, ".") && matches(tokens, at + 2, "get") && matches(tokens, at + 3, "(")
                && at + 5 < tokens.size() && tokens.get(at + 4).type == TokenType.STRING) {
            String name = tokens.get(at + 4).value;
            if (tokens.get(at + 5).is(")")) {
                return new FieldRef(name, at + 6, null);
            }
            if (tokens.get(at + 5).is(",")) {
                int close = closingParen(tokens, at + 6);
                if (close > at + 6) {
                    return new FieldRef(name, close + 1, renderFallback(tokens.subList(at + 6, close)));
                }
            }
            return null;
        }
        if (matches(tokens, at + 1, ".") && at + 2 < tokens.size() && tokens.get(at + 2).type == TokenType.IDENT
                && !tokens.get(at + 2).is("get")) {
            return new FieldRef(tokens.get(at + 2).text, at + 3, null);
        }
        return null;
    }

    // index of the ")" closing a call whose arguments start at 'from'; -1 when unbalanced
    private static int closingParen(List<Token> tokens, int from) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is("(") || token.is("[")) {
                depth++;
            } else if (token.is(")") || token.is("]")) {
                if (depth == 0) return token.is(")") ? i : -1;
                depth--;
            }
        }
        return -1;
    }

    // default argument of state.get: literals are translated, everything else is kept as written
    private static String renderFallback(List<Token> tokens) {
        List<Unit> units = new ArrayList<>();
        for (Token token : tokens) {
            switch (token.type) {
                case STRING -> units.add(Unit.literal(PythonLiterals.quote(token.value), FieldType.TEXT));
                case NUMBER -> units.add(Unit.literal(token.text, FieldType.NUMBER));
                case IDENT  -> units.add(isJsConstant(token.text)
                        ? Unit.literal(pythonConstant(token.text), null) : Unit.raw(token.text));
                case OP     -> units.add(Unit.op(token.text));
            }
        }
        return render(units);
    }

    private static ConditionExpression translatePredicate(String source, List<Token> tokens) {
        List<Unit> units = new ArrayList<>();
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            FieldRef ref = stateReference(tokens, i);
            if (ref != null) {
                units.add(Unit.field(ref.name, ref.fallback));
                i = ref.end;
                continue;
            }
            Token previous = i > 0 ? tokens.get(i - 1) : null;
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            switch (token.type) {
                case IDENT -> {
                    String word = token.text;
                    if (PYTHON_WORDS.contains(word)) {
                        units.add(Unit.word(word));
                    } else if (isJsConstant(word)) {
                        units.add(Unit.literal(pythonConstant(word), word.equals("true") || word.equals("false")
                                ? FieldType.BOOLEAN : null));
                    } else if (word.equals("AND") || word.equals("OR") || word.equals("NOT")) {
                        units.add(Unit.word(word.toLowerCase(Locale.ROOT)));
                    } else if (word.equals("state") || (previous != null && previous.is("."))
                            || (next != null && next.is("("))) {
                        // the state mapping itself, attribute access or function call
                        units.add(Unit.raw(word));
                    } else {
                        units.add(Unit.field(word));
                    }
                }
                case STRING -> units.add(Unit.literal(PythonLiterals.quote(token.value), FieldType.TEXT));
                case NUMBER -> units.add(Unit.literal(token.text, FieldType.NUMBER));
                case OP -> {
                    switch (token.text) {
                        case "&&" -> units.add(Unit.word("and"));
                        case "||" -> units.add(Unit.word("or"));
                        case "!"  -> units.add(Unit.word("not"));
                        case "===" -> units.add(Unit.op("=="));
                        case "!==" -> units.add(Unit.op("!="));
                        default   -> units.add(Unit.op(token.text));
                    }
                }
            }
            i++;
        }

        Map<String, FieldType> fields = new LinkedHashMap<>();
        for (int u = 0; u < units.size(); u++) {
            Unit unit = units.get(u);
            if (unit.field == null) continue;
            FieldType type = comparedLiteralType(units, u);
            FieldType known = fields.get(unit.field);
            if (!fields.containsKey(unit.field) || (known == null && type != null)) {
                fields.put(unit.field, type);
            }
        }
        return new ConditionExpression(source, Kind.PREDICATE, null, null, render(units), fields);
    }

    private static FieldType comparedLiteralType(List<Unit> units, int fieldAt) {
        if (fieldAt + 2 < units.size() && COMPARISONS.contains(units.get(fieldAt + 1).text)
                && units.get(fieldAt + 2).literalType != null) {
            return units.get(fieldAt + 2).literalType;
        }
        if (fieldAt - 2 >= 0 && COMPARISONS.contains(units.get(fieldAt - 1).text)
                && units.get(fieldAt - 2).literalType != null) {
            return units.get(fieldAt - 2).literalType;
        }
        return null;
    }

    private static String render(List<Unit> units) {
        StringBuilder out = new StringBuilder();
        Unit previous = null;
        for (Unit unit : units) {
            if (previous != null && needsSpace(previous, unit)) out.append(' ');
            out.append(unit.text);
            previous = unit;
        }
        return out.toString();
    }

    private static boolean needsSpace(Unit previous, Unit current) {
        String p = previous.text;
        String c = current.text;
        if (p.equals("(") || p.equals("[") || p.equals(".")) return false;
        if (c.equals(")") || c.equals("]") || c.equals(",") || c.equals(".")) return false;
        // call or subscript directly after a name or closing bracket
        if ((c.equals("(") || c.equals("[")) && !previous.isOperatorLike()) return false;
        return true;
    }

    private static String pythonConstant(String word) {
        return switch (word) {
            case "true"  -> "True";
            case "false" -> "False";
            default      -> "None";
        };
    }

    private static boolean matches(List<Token> tokens, int at, String text) {
        return at < tokens.size() && tokens.get(at).is(text);
    }

    private static boolean isJsConstant(String word) {
        return word.equals("true") || word.equals("false") || word.equals("null") || word.equals("none");
    }

    private static boolean isFieldName(String word) {
        return !PYTHON_WORDS.contains(word) && !isJsConstant(word) && !word.equals("state");
    }

    // ── Tokens ────────────────────────────────────────────────────────────────

    private enum TokenType { IDENT, STRING, NUMBER, OP }

    private record Token(TokenType type, String text, String value) {
        boolean is(String s) {
            return type != TokenType.STRING && text.equals(s);
        }

        boolean isLiteral() {
            return type == TokenType.STRING || type == TokenType.NUMBER
                    || (type == TokenType.IDENT && (text.equals("True") || text.equals("False")
                        || text.equals("true") || text.equals("false")));
        }
    }

    private record Literal(String text, String python, FieldType type) {
        static Literal of(Token token) {
            return switch (token.type) {
                case STRING -> new Literal(token.value, PythonLiterals.quote(token.value), FieldType.TEXT);
                case NUMBER -> new Literal(token.text, token.text, FieldType.NUMBER);
                default     -> {
                    boolean truth = token.text.equalsIgnoreCase("true");
                    yield new Literal(truth ? "True" : "False", truth ? "True" : "False", FieldType.BOOLEAN);
                }
            };
        }
    }

    private static final class Unit {
        final String text;
        final String field;
        final FieldType literalType;
        final boolean operator;

        private Unit(String text, String field, FieldType literalType, boolean operator) {
            this.text = text;
            this.field = field;
            this.literalType = literalType;
            this.operator = operator;
        }

        static Unit field(String name) {
            return field(name, null);
        }

        static Unit field(String name, String fallback) {
            String lookup = fallback == null
                    ? "state.get(" + PythonLiterals.quote(name) + ")"
                    : "state.get(" + PythonLiterals.quote(name) + ", " + fallback + ")";
            return new Unit(lookup, name, null, false);
        }

        static Unit literal(String python, FieldType type) {
            return new Unit(python, null, type, false);
        }

        static Unit word(String word) {
            return new Unit(word, null, null, true);
        }

        static Unit op(String op) {
            return new Unit(op, null, null, !op.equals(")") && !op.equals("]"));
        }

        static Unit raw(String text) {
            return new Unit(text, null, null, false);
        }

        boolean isOperatorLike() {
            return operator;
        }
    }

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '"' || c == '\'') {
                StringBuilder value = new StringBuilder();
                int j = i + 1;
                while (j < text.length() && text.charAt(j) != c) {
                    if (text.charAt(j) == '\\' && j + 1 < text.length()) j++;
                    value.append(text.charAt(j));
                    j++;
                }
                if (j >= text.length()) {
                    throw new IllegalArgumentException("Unterminated string in condition: " + text);
                }
                tokens.add(new Token(TokenType.STRING, text.substring(i, j + 1), value.toString()));
                i = j + 1;
            } else if (Character.isDigit(c)) {
                int j = i;
                while (j < text.length() && (Character.isDigit(text.charAt(j)) || text.charAt(j) == '.')) j++;
                tokens.add(new Token(TokenType.NUMBER, text.substring(i, j), null));
                i = j;
            } else if (Character.isLetter(c) || c == '_') {
                int j = i;
                while (j < text.length() && (Character.isLetterOrDigit(text.charAt(j)) || text.charAt(j) == '_')) j++;
                tokens.add(new Token(TokenType.IDENT, text.substring(i, j), null));
                i = j;
            } else {
                String op = operatorAt(text, i);
                if (op == null) {
                    throw new IllegalArgumentException("Unexpected character '" + c + "' in condition: " + text);
                }
                tokens.add(new Token(TokenType.OP, op, null));
                i += op.length();
            }
        }
        return tokens;
    }

    private static String operatorAt(String text, int i) {
        for (String op : List.of("===", "!==", "==", "!=", "<=", ">=", "&&", "||")) {
            if (text.startsWith(op, i)) return op;
        }
        char c = text.charAt(i);
        return "<>!()[].,+-*/%".indexOf(c) >= 0 ? String.valueOf(c) : null;
    }
}
