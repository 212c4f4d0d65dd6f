package com.nexflow.nexflow_compiler.analysis;

import com.nexflow.nexflow_compiler.model.domain.FieldSpec;
import com.nexflow.nexflow_compiler.model.domain.FieldType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionExpressionTest {

    @Test
    void defaultWords() {
        assertThat(ConditionExpression.parse("else").isDefault()).isTrue();
        assertThat(ConditionExpression.parse(" Otherwise ").kind()).isEqualTo(ConditionExpression.Kind.DEFAULT);
        assertThat(ConditionExpression.parse("default").referencedFields("route")).isEmpty();
    }

    @Test
    void bareLiteralComparesTheRouteField() {
        ConditionExpression condition = ConditionExpression.parse("positive");

        assertThat(condition.kind()).isEqualTo(ConditionExpression.Kind.VALUE);
        assertThat(condition.routeKey()).isEqualTo("positive");
        assertThat(condition.toPython("sentiment")).isEqualTo("state.get(\"sentiment\") == \"positive\"");
        assertThat(condition.referencedFields("sentiment")).containsExactly(FieldSpec.of("sentiment", FieldType.TEXT));
    }

    @Test
    void quotedAndNumericLiterals() {
        assertThat(ConditionExpression.parse("'needs review'").routeKey()).isEqualTo("needs review");
        ConditionExpression number = ConditionExpression.parse("42");
        assertThat(number.toPython("route")).isEqualTo("state.get(\"route\") == 42");
        assertThat(number.referencedFields("route")).containsExactly(FieldSpec.of("route", FieldType.NUMBER));
    }

    @Test
    void equalityOnNamedField() {
        ConditionExpression condition = ConditionExpression.parse("state[\"intent\"] == \"refund\"");

        assertThat(condition.kind()).isEqualTo(ConditionExpression.Kind.VALUE);
        assertThat(condition.valueField("route")).isEqualTo("intent");
        assertThat(condition.toPython("route")).isEqualTo("state.get(\"intent\") == \"refund\"");

        assertThat(ConditionExpression.parse("'yes' == answer").valueField("route")).isEqualTo("answer");
    }

    @Test
    void predicatesAreTranslated() {
        ConditionExpression condition = ConditionExpression.parse("score >= 0.5 && !done");

        assertThat(condition.kind()).isEqualTo(ConditionExpression.Kind.PREDICATE);
        assertThat(condition.toPython("route"))
                .isEqualTo("state.get(\"score\") >= 0.5 and not state.get(\"done\")");
        assertThat(condition.referencedFields("route"))
                .containsExactly(FieldSpec.of("score", FieldType.NUMBER), FieldSpec.of("done", null));
    }

    @Test
    void stateGetWithDefaultNamesTheFieldAndKeepsTheDefault() {
        ConditionExpression condition = ConditionExpression.parse("state.get('attempts', 0) < 3");

        assertThat(condition.kind()).isEqualTo(ConditionExpression.Kind.PREDICATE);
        assertThat(condition.toPython("route")).isEqualTo("state.get(\"attempts\", 0) < 3");
        assertThat(condition.referencedFields("route")).containsExactly(FieldSpec.of("attempts", FieldType.NUMBER));
    }

    @Test
    void equalityOnLookupWithDefaultStaysAPredicate() {
        ConditionExpression condition = ConditionExpression.parse("state.get(\"mode\", 'fast') == 'fast'");

        assertThat(condition.kind()).isEqualTo(ConditionExpression.Kind.PREDICATE);
        assertThat(condition.toPython("route")).isEqualTo("state.get(\"mode\", \"fast\") == \"fast\"");
        assertThat(condition.referencedFields("route")).containsExactly(FieldSpec.of("mode", FieldType.TEXT));
    }

    @Test
    void bareStateIsTheMappingNotAField() {
        ConditionExpression condition = ConditionExpression.parse("'draft' in state");

        assertThat(condition.toPython("route")).isEqualTo("\"draft\" in state");
        assertThat(condition.referencedFields("route")).isEmpty();
    }

    @Test
    void predicateKeepsCallsAndTranslatesConstants() {
        ConditionExpression condition = ConditionExpression.parse("len(items) > 3 || flag === true");

        assertThat(condition.toPython("route"))
                .isEqualTo("len(state.get(\"items\")) > 3 or state.get(\"flag\") == True");
        assertThat(condition.referencedFields("route"))
                .containsExactly(FieldSpec.of("items", null), FieldSpec.of("flag", FieldType.BOOLEAN));
    }

    @Test
    void rejectsUnreadableText() {
        assertThatThrownBy(() -> ConditionExpression.parse("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConditionExpression.parse("x == 'open")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConditionExpression.parse("a @ b")).isInstanceOf(IllegalArgumentException.class);
    }
}
