package com.nexflow.nexflow_compiler.validator;

import com.nexflow.nexflow_compiler.ConversionStage;
import com.nexflow.nexflow_compiler.TestFlows;
import com.nexflow.nexflow_compiler.exception.CodeValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeValidatorTest {

    private final CodeValidator validator = new CodeValidator(TestFlows.PROPERTIES);

    // ── Repairs ───────────────────────────────────────────────────────────────

    @Test
    void expandsTabsAndAddsMissingDocstring() {
        ValidationReport report = validator.validate("def f(state):\n\treturn state\n");

        assertThat(report.text()).isEqualTo("def f(state):\n"
                + "    \"\"\"Process the state in f.\"\"\"\n"
                + "    return state\n");
        assertThat(report.warnings()).containsExactly(
                "Line 2: tab indentation expanded",
                "Line 1: docstring added to f");
    }

    @Test
    void fillsBlockThatLostItsBody() {
        ValidationReport report = validator.validate("def f(state):\n"
                + "    \"\"\"Doc.\"\"\"\n"
                + "    for item in items:\n"
                + "result = 1\n");

        assertThat(report.text()).isEqualTo("def f(state):\n"
                + "    \"\"\"Doc.\"\"\"\n"
                + "    for item in items:\n"
                + "        pass\n"
                + "result = 1\n");
        assertThat(report.warnings()).containsExactly("Line 3: empty block filled with pass");
    }

    @Test
    void fillsBodyBeforeClause() {
        ValidationReport report = validator.validate("if a:\nelse:\n    b = 1\n");

        assertThat(report.text()).isEqualTo("if a:\n    pass\nelse:\n    b = 1\n");
        assertThat(report.warnings()).containsExactly("Line 1: empty block filled with pass");
    }

    @Test
    void appendsMissingCloserToItsOwnStatement() {
        ValidationReport report = validator.validate("values = [1, 2\ntotal = sum(values)\n");

        assertThat(report.text()).isEqualTo("values = [1, 2]\ntotal = sum(values)\n");
        assertThat(report.warnings()).containsExactly("Line 1: missing ']' appended");
    }

    @Test
    void removesUnmatchedAndFixesMismatchedClosers() {
        assertThat(validator.validate("x = foo(1))\n").text()).isEqualTo("x = foo(1)\n");

        ValidationReport mismatched = validator.validate("y = [1, 2)\n");
        assertThat(mismatched.text()).isEqualTo("y = [1, 2]\n");
        assertThat(mismatched.warnings()).containsExactly("Line 1: ')' replaced by ']'");
    }

    @Test
    void closesUnterminatedStrings() {
        ValidationReport triple = validator.validate("def f(state):\n"
                + "    \"\"\"Doc without end\n"
                + "    return state\n");

        assertThat(triple.text()).isEqualTo("def f(state):\n"
                + "    \"\"\"Doc without end\"\"\"\n"
                + "    return state\n");
        assertThat(triple.warnings()).containsExactly("Line 2: unterminated \"\"\" string closed");

        ValidationReport single = validator.validate("name = 'abc\n");
        assertThat(single.text()).isEqualTo("name = 'abc'\n");
        assertThat(single.warnings()).containsExactly("Line 1: unterminated string closed");
    }

    @Test
    void reindentsToConfiguredUnit() {
        ValidationReport report = validator.validate("def f(state):\n  \"\"\"Doc.\"\"\"\n  return state\n");

        assertThat(report.text()).isEqualTo("def f(state):\n    \"\"\"Doc.\"\"\"\n    return state\n");
        assertThat(report.warnings()).containsExactly(
                "Line 2: indentation 2 -> 4",
                "Line 3: indentation 2 -> 4");
    }

    @Test
    void continuationLinesKeepTheirOffset() {
        String program = "graph.add_conditional_edges(\n"
                + "    \"a\",\n"
                + "    route_after_a,\n"
                + ")\n";

        ValidationReport report = validator.validate("def route_after_a(state):\n    \"\"\"R.\"\"\"\n    return \"x\"\n"
                + "def a(state):\n    \"\"\"A.\"\"\"\n    return state\n"
                + "graph.add_node(\"a\", a)\n" + program);

        assertThat(report.repaired()).isFalse();
        assertThat(report.text()).endsWith(program);
    }

    // ── Idempotence ───────────────────────────────────────────────────────────

    @Test
    void repairedOutputValidatesCleanly() {
        ValidationReport first = validator.validate("def f(state):\n\tfor x in xs:\n  y = [1, 2\nz = 'open\n");
        ValidationReport second = validator.validate(first.text());

        assertThat(first.repaired()).isTrue();
        assertThat(second.warnings()).isEmpty();
        assertThat(second.text()).isEqualTo(first.text());
    }

    @ParameterizedTest
    @ValueSource(strings = {"linear_chain.json", "router_no_default.json", "loop_counter.json", "langflow_export.json"})
    void generatedProgramsPassUnchanged(String fixture) {
        String generated = TestFlows.compiler().compile(TestFlows.read(fixture), "flow", false).text();

        ValidationReport report = validator.validate(generated);

        assertThat(report.warnings()).isEmpty();
        assertThat(report.text()).isEqualTo(generated);
    }

    // ── Wiring ────────────────────────────────────────────────────────────────

    @Test
    void rejectsEdgeToUnregisteredNode() {
        String program = "def a(state):\n"
                + "    \"\"\"A.\"\"\"\n"
                + "    return state\n"
                + "graph.add_node(\"a\", a)\n"
                + "graph.add_edge(START, \"a\")\n"
                + "graph.add_edge(\"a\", \"b\")\n";

        assertThatThrownBy(() -> validator.validate(program))
                .isInstanceOf(CodeValidationException.class)
                .hasMessage("Program wires undefined functions or nodes: [b]")
                .satisfies(ex -> {
                    CodeValidationException failure = (CodeValidationException) ex;
                    assertThat(failure.getStage()).isEqualTo(ConversionStage.VALIDATION);
                    assertThat(failure.getOffendingIds()).containsExactly("b");
                });
    }

    @Test
    void rejectsNodeBoundToMissingFunction() {
        assertThatThrownBy(() -> validator.validate("graph.add_node(\"x\", missing_fn)\ngraph.add_edge(\"x\", END)\n"))
                .isInstanceOf(CodeValidationException.class)
                .hasMessageContaining("missing_fn");
    }
}
