package com.nexflow.nexflow_compiler.validator;

import com.nexflow.nexflow_compiler.config.ConverterProperties;
import com.nexflow.nexflow_compiler.exception.CodeValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks emitted Python for structural soundness and repairs what it safely can.
 *
 * Repairs (each recorded as a warning with its line number):
 *   - tab indentation expanded to one indent unit per tab
 *   - unterminated strings closed (single-quoted at end of line, triple-quoted at end of the opening line)
 *   - unmatched or mismatched closing brackets dropped or corrected, missing ones appended
 *     to the last line of their statement
 *   - every statement re-indented to unit x depth; continuation lines keep their offset
 *   - a block header without a body gets `pass`; a function without docstring gets one
 *
 * Not repaired: wiring that references a function or node the program never defines
 * ({@link CodeValidationException}).
 *
 * Running the validator on its own output changes nothing and reports nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeValidator {

    private static final Pattern CLAUSE = Pattern.compile("^(elif|else|except|finally)\\b");
    private static final Pattern DEF = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)");
    private static final Pattern STRING_START = Pattern.compile("^[rRuUbBfF]{0,2}(\"|')");

    private static final Pattern DEFINED_FUNCTION = Pattern.compile("(?m)^\\s*(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern ADD_NODE =
            Pattern.compile("graph\\.add_node\\(\\s*[\"']([^\"']+)[\"']\\s*,\\s*([A-Za-z_]\\w*)\\s*\\)");
    private static final Pattern ADD_NODE_BARE = Pattern.compile("graph\\.add_node\\(\\s*([A-Za-z_]\\w*)\\s*\\)");
    private static final Pattern ADD_EDGE = Pattern.compile(
            "graph\\.add_edge\\(\\s*(START|END|[\"'][^\"']+[\"'])\\s*,\\s*(START|END|[\"'][^\"']+[\"'])\\s*\\)");
    private static final Pattern ADD_CONDITIONAL = Pattern.compile(
            "graph\\.add_conditional_edges\\(\\s*[\"']([^\"']+)[\"']\\s*,\\s*([A-Za-z_]\\w*)\\s*(?:,\\s*\\{([^}]*)})?",
            Pattern.DOTALL);
    private static final Pattern MAPPING_TARGET = Pattern.compile("[\"'][^\"']*[\"']\\s*:\\s*(END|START|[\"']([^\"']+)[\"'])");
    private static final Pattern ENTRY_OR_FINISH =
            Pattern.compile("graph\\.set_(?:entry|finish)_point\\(\\s*[\"']([^\"']+)[\"']\\s*\\)");

    private final ConverterProperties properties;

    public ValidationReport validate(String program) {
        String unit = properties.indentString();
        List<String> warnings = new ArrayList<>();

        List<String> lines = expandTabs(program, unit, warnings);
        List<LineInfo> infos = lexUntilStable(lines, warnings);
        String fixed = restructure(lines, infos, unit, warnings);
        checkWiring(fixed);

        if (!warnings.isEmpty()) {
            log.warn("Validator applied {} repair(s) to the generated program", warnings.size());
            warnings.forEach(w -> log.debug("  {}", w));
        }
        return new ValidationReport(fixed, warnings);
    }

    // ── Tabs ──────────────────────────────────────────────────────────────────

    private static List<String> expandTabs(String program, String unit, List<String> warnings) {
        List<String> lines = new ArrayList<>();
        String[] raw = program.split("\\R", -1);
        for (int i = 0; i < raw.length; i++) {
            String line = raw[i];
            int end = 0;
            while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) end++;
            String leading = line.substring(0, end);
            if (leading.indexOf('\t') >= 0) {
                line = leading.replace("\t", unit) + line.substring(end);
                warnings.add("Line " + (i + 1) + ": tab indentation expanded");
            }
            lines.add(line);
        }
        // split leaves one empty element after a final newline
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);
        return lines;
    }

    // ── Lexing ────────────────────────────────────────────────────────────────

    private enum Kind { BLANK, COMMENT, CODE, CONTINUATION, STRING_BODY }

    private static final class LineInfo {
        final Kind kind;
        final int indent;
        char lastCode;
        int commentAt;
        int bracketsAtEnd;
        boolean stringOpenAtEnd;

        LineInfo(Kind kind, int indent) {
            this.kind = kind;
            this.indent = indent;
        }
    }

    private record Unterminated(int line, String delimiter) {}

    private static List<LineInfo> lexUntilStable(List<String> lines, List<String> warnings) {
        while (true) {
            List<String> attempt = new ArrayList<>();
            List<LineInfo> infos = new ArrayList<>();
            List<String> working = new ArrayList<>(lines);
            Unterminated open = lex(working, infos, attempt);
            if (open == null) {
                lines.clear();
                lines.addAll(working);
                warnings.addAll(attempt);
                return infos;
            }
            lines.set(open.line, lines.get(open.line).stripTrailing() + open.delimiter);
            warnings.add("Line " + (open.line + 1) + ": unterminated " + open.delimiter + " string closed");
        }
    }

    // Classifies each line and applies the in-line repairs; reports a triple-quoted string left open at EOF
    private static Unterminated lex(List<String> lines, List<LineInfo> infos, List<String> warnings) {
        Deque<Character> brackets = new ArrayDeque<>();
        String triple = null;
        int tripleLine = -1;
        boolean backslash = false;
        int statementIndent = 0;
        int lastCodeLine = -1;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String stripped = line.strip();
            int indent = leadingSpaces(line);

            Kind kind;
            if (triple != null) {
                kind = Kind.STRING_BODY;
            } else if (!brackets.isEmpty() && !backslash && startsNewStatement(stripped, indent, statementIndent)) {
                closeBrackets(lines, infos, lastCodeLine, brackets, warnings);
                kind = classify(stripped);
            } else if (!brackets.isEmpty() || backslash) {
                kind = Kind.CONTINUATION;
            } else {
                kind = classify(stripped);
            }
            if (kind == Kind.CODE) statementIndent = indent;
            backslash = false;

            LineInfo info = new LineInfo(kind, indent);
            info.commentAt = -1;
            StringBuilder rebuilt = new StringBuilder(line.length() + 4);
            char quote = 0;

            for (int j = 0; j < line.length(); j++) {
                char c = line.charAt(j);
                if (triple != null) {
                    if (line.startsWith(triple, j)) {
                        rebuilt.append(triple);
                        j += 2;
                        triple = null;
                        info.lastCode = c;
                    } else if (c == '\\' && j + 1 < line.length()) {
                        rebuilt.append(c).append(line.charAt(++j));
                    } else {
                        rebuilt.append(c);
                    }
                    continue;
                }
                if (quote != 0) {
                    rebuilt.append(c);
                    if (c == '\\' && j + 1 < line.length()) {
                        rebuilt.append(line.charAt(++j));
                    } else if (c == quote) {
                        quote = 0;
                        info.lastCode = c;
                    }
                    continue;
                }
                if (c == '#') {
                    info.commentAt = rebuilt.length();
                    rebuilt.append(line, j, line.length());
                    break;
                }
                if (c == '"' || c == '\'') {
                    String three = String.valueOf(c).repeat(3);
                    if (line.startsWith(three, j)) {
                        triple = three;
                        tripleLine = i;
                        rebuilt.append(three);
                        j += 2;
                    } else {
                        quote = c;
                        rebuilt.append(c);
                    }
                    info.lastCode = c;
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    brackets.push(c);
                } else if (c == ')' || c == ']' || c == '}') {
                    if (brackets.isEmpty()) {
                        warnings.add("Line " + (i + 1) + ": unmatched '" + c + "' removed");
                        continue;
                    }
                    char expected = closerOf(brackets.pop());
                    if (c != expected) {
                        warnings.add("Line " + (i + 1) + ": '" + c + "' replaced by '" + expected + "'");
                        c = expected;
                    }
                }
                if (!Character.isWhitespace(c)) info.lastCode = c;
                rebuilt.append(c);
            }

            if (quote != 0) {
                trimTrailing(rebuilt);
                rebuilt.append(quote);
                info.lastCode = quote;
                warnings.add("Line " + (i + 1) + ": unterminated string closed");
            }
            if (triple == null && info.commentAt < 0 && info.lastCode == '\\') {
                backslash = true;
            }
            info.bracketsAtEnd = brackets.size();
            info.stringOpenAtEnd = triple != null;
            lines.set(i, rebuilt.toString());
            infos.add(info);
            if (kind != Kind.BLANK && kind != Kind.COMMENT && info.lastCode != 0) lastCodeLine = i;
        }

        if (triple != null) return new Unterminated(tripleLine, triple);
        if (!brackets.isEmpty()) closeBrackets(lines, infos, lastCodeLine, brackets, warnings);
        return null;
    }

    private static Kind classify(String stripped) {
        if (stripped.isEmpty()) return Kind.BLANK;
        if (stripped.startsWith("#")) return Kind.COMMENT;
        return Kind.CODE;
    }

    // A line at or left of the open statement's column that does not start with a closer begins a new statement
    private static boolean startsNewStatement(String stripped, int indent, int statementIndent) {
        if (stripped.isEmpty() || stripped.startsWith("#")) return false;
        char first = stripped.charAt(0);
        return indent <= statementIndent && first != ')' && first != ']' && first != '}';
    }

    private static void closeBrackets(List<String> lines, List<LineInfo> infos, int target,
                                      Deque<Character> brackets, List<String> warnings) {
        StringBuilder closers = new StringBuilder();
        for (char opener : brackets) closers.append(closerOf(opener));
        brackets.clear();
        if (target < 0) return;

        LineInfo info = infos.get(target);
        String line = lines.get(target);
        String updated;
        if (info.commentAt >= 0) {
            String code = line.substring(0, info.commentAt).stripTrailing();
            updated = code + closers + "  " + line.substring(info.commentAt);
            info.commentAt = code.length() + closers.length() + 2;
        } else {
            updated = line.stripTrailing() + closers;
        }
        lines.set(target, updated);
        info.lastCode = closers.charAt(closers.length() - 1);
        info.bracketsAtEnd = 0;
        warnings.add("Line " + (target + 1) + ": missing '" + closers + "' appended");
    }

    private static char closerOf(char opener) {
        return switch (opener) {
            case '(' -> ')';
            case '[' -> ']';
            default  -> '}';
        };
    }

    // ── Re-indentation and block repair ───────────────────────────────────────

    private record Block(int headerCol, int bodyCol) {}

    private record Header(int col, int depth, boolean function, String name, int line) {}

    private static String restructure(List<String> lines, List<LineInfo> infos, String unit, List<String> warnings) {
        List<String> out = new ArrayList<>();
        Deque<Block> stack = new ArrayDeque<>();
        List<Integer> buffered = new ArrayList<>();
        Header pending = null;

        int i = 0;
        while (i < lines.size()) {
            LineInfo info = infos.get(i);
            if (info.kind == Kind.BLANK || info.kind == Kind.COMMENT) {
                buffered.add(i++);
                continue;
            }
            int end = i + 1;
            while (end < lines.size()
                    && (infos.get(end).kind == Kind.CONTINUATION || infos.get(end).kind == Kind.STRING_BODY)) {
                end++;
            }

            int col = info.indent;
            String first = lines.get(i).strip();
            int depth = -1;

            if (pending != null) {
                boolean clause = CLAUSE.matcher(first).find();
                if ((clause && col <= pending.col()) || col < pending.col()) {
                    fillEmptyBlock(pending, out, unit, warnings);
                } else {
                    stack.push(new Block(pending.col(), col));
                    depth = stack.size();
                    if (pending.function() && !STRING_START.matcher(first).find()) {
                        out.add(unit.repeat(depth) + docstring(pending.name()));
                        warnings.add("Line " + (pending.line() + 1) + ": docstring added to " + pending.name());
                    }
                }
                pending = null;
            }
            if (depth < 0) depth = dedentTo(col, stack);

            flush(buffered, lines, infos, out, unit.repeat(depth), warnings);
            emitStatement(lines, infos, i, end, unit.repeat(depth), out, warnings);

            if (isHeader(infos, i, end)) {
                Matcher def = DEF.matcher(first);
                boolean function = def.find();
                pending = new Header(col, depth, function, function ? def.group(1) : null, i);
            }
            i = end;
        }
        if (pending != null) fillEmptyBlock(pending, out, unit, warnings);
        flush(buffered, lines, infos, out, "", warnings);

        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) out.remove(out.size() - 1);
        return out.isEmpty() ? "" : String.join("\n", out) + "\n";
    }

    private static int dedentTo(int col, Deque<Block> stack) {
        Block lastPopped = null;
        while (!stack.isEmpty() && col < stack.peek().bodyCol()) {
            lastPopped = stack.pop();
        }
        int levelCol = stack.isEmpty() ? 0 : stack.peek().bodyCol();
        // between two open levels: snap to the nearer one
        if (col > levelCol && lastPopped != null && lastPopped.bodyCol() - col < col - levelCol) {
            stack.push(lastPopped);
        }
        return stack.size();
    }

    private static boolean isHeader(List<LineInfo> infos, int start, int end) {
        for (int k = end - 1; k >= start; k--) {
            LineInfo info = infos.get(k);
            if (info.lastCode == 0) continue;
            return info.lastCode == ':' && info.bracketsAtEnd == 0 && !info.stringOpenAtEnd;
        }
        return false;
    }

    private static void fillEmptyBlock(Header header, List<String> out, String unit, List<String> warnings) {
        String filler = header.function() ? docstring(header.name()) : "pass";
        out.add(unit.repeat(header.depth() + 1) + filler);
        warnings.add("Line " + (header.line() + 1) + ": empty block filled with " + (header.function() ? "a docstring" : "pass"));
    }

    private static String docstring(String functionName) {
        return "\"\"\"Process the state in " + functionName + ".\"\"\"";
    }

    private static void flush(List<Integer> buffered, List<String> lines, List<LineInfo> infos, List<String> out,
                              String indent, List<String> warnings) {
        for (int k : buffered) {
            if (infos.get(k).kind == Kind.BLANK) {
                out.add("");
            } else {
                out.add(reindent(lines.get(k), indent, k, warnings));
            }
        }
        buffered.clear();
    }

    private static void emitStatement(List<String> lines, List<LineInfo> infos, int start, int end, String indent,
                                      List<String> out, List<String> warnings) {
        int statementCol = infos.get(start).indent;
        out.add(reindent(lines.get(start), indent, start, warnings));
        for (int k = start + 1; k < end; k++) {
            LineInfo info = infos.get(k);
            String line = lines.get(k);
            if (info.kind == Kind.STRING_BODY) {
                out.add(line);
            } else if (line.isBlank()) {
                out.add("");
            } else {
                int offset = Math.max(0, info.indent - statementCol);
                out.add(indent + " ".repeat(offset) + line.strip());
            }
        }
    }

    private static String reindent(String line, String indent, int index, List<String> warnings) {
        int current = leadingSpaces(line);
        if (current != indent.length()) {
            warnings.add("Line " + (index + 1) + ": indentation " + current + " -> " + indent.length());
        }
        return indent + line.strip();
    }

    private static int leadingSpaces(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') n++;
        return n;
    }

    private static void trimTrailing(StringBuilder text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) end--;
        text.setLength(end);
    }

    // ── Wiring ────────────────────────────────────────────────────────────────

    private static void checkWiring(String program) {
        Set<String> functions = new HashSet<>();
        Matcher def = DEFINED_FUNCTION.matcher(program);
        while (def.find()) functions.add(def.group(1));

        Set<String> nodes = new HashSet<>();
        Set<String> undefined = new LinkedHashSet<>();

        Matcher addNode = ADD_NODE.matcher(program);
        while (addNode.find()) {
            nodes.add(addNode.group(1));
            if (!functions.contains(addNode.group(2))) undefined.add(addNode.group(2));
        }
        Matcher bare = ADD_NODE_BARE.matcher(program);
        while (bare.find()) {
            nodes.add(bare.group(1));
            if (!functions.contains(bare.group(1))) undefined.add(bare.group(1));
        }

        List<String> referenced = new ArrayList<>();
        Matcher edge = ADD_EDGE.matcher(program);
        while (edge.find()) {
            referenced.add(edge.group(1));
            referenced.add(edge.group(2));
        }
        Matcher conditional = ADD_CONDITIONAL.matcher(program);
        while (conditional.find()) {
            referenced.add("\"" + conditional.group(1) + "\"");
            if (!functions.contains(conditional.group(2))) undefined.add(conditional.group(2));
            if (conditional.group(3) != null) {
                Matcher target = MAPPING_TARGET.matcher(conditional.group(3));
                while (target.find()) referenced.add(target.group(1));
            }
        }
        Matcher marks = ENTRY_OR_FINISH.matcher(program);
        while (marks.find()) referenced.add("\"" + marks.group(1) + "\"");

        for (String ref : referenced) {
            if (ref.equals("START") || ref.equals("END")) continue;
            String name = ref.substring(1, ref.length() - 1);
            if (!nodes.contains(name)) undefined.add(name);
        }

        if (!undefined.isEmpty()) {
            throw new CodeValidationException("Program wires undefined functions or nodes: " + undefined,
                    List.copyOf(undefined));
        }
    }
}
