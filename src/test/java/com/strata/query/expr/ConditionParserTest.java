package com.strata.query.expr;

import com.strata.query.error.QueryGatewayException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConditionParser")
class ConditionParserTest {

    @Test
    @DisplayName("should parse a simple comparison")
    void shouldParseSimpleComparison() {
        Expr parsed = ConditionParser.parse(List.of("environment", "=", "prod"));

        assertThat(parsed).isEqualTo(Comparison.of("environment", "=", "prod"));
    }

    @Test
    @DisplayName("should parse IN and NOT IN as operators")
    void shouldParseMembershipAsOperators() {
        Expr in = ConditionParser.parse(List.of("project_id", "IN", List.of(1, 2)));
        Expr notIn = ConditionParser.parse(List.of("project_id", "NOT IN", List.of(3)));

        assertThat(in).isEqualTo(Comparison.of("project_id", "IN", List.of(1, 2)));
        assertThat(notIn).isEqualTo(Comparison.of("project_id", "NOT IN", List.of(3)));
    }

    @Test
    @DisplayName("should parse a function call condition")
    void shouldParseFunctionCall() {
        Expr parsed = ConditionParser.parse(List.of("equals", List.of("myTag", "'x'")));

        assertThat(parsed).isInstanceOf(FunctionCall.class);
        FunctionCall call = (FunctionCall) parsed;
        assertThat(call.getName()).isEqualTo("equals");
        assertThat(call.getArgs()).containsExactly(Term.of("myTag"), Term.of("'x'"));
        assertThat(call.getAlias()).isNull();
    }

    @Test
    @DisplayName("should parse a comparison on a function result")
    void shouldParseComparisonOnFunction() {
        Expr parsed = ConditionParser.parse(List.of(List.of("ifNull", List.of("user", "''")), "!=", ""));

        assertThat(parsed).isInstanceOf(Comparison.class);
        Comparison comparison = (Comparison) parsed;
        assertThat(comparison.getColumn()).isEqualTo(
            new FunctionCall("ifNull", List.of(Term.of("user"), Term.of("''"))));
        assertThat(comparison.getColumnName()).isNull();
        assertThat(comparison.getOperator()).isEqualTo("!=");
    }

    @Test
    @DisplayName("should parse nested calls inside argument lists")
    void shouldParseNestedCalls() {
        // Given: has(tags.key, lower('Foo')) in the flattened argument form
        List<Object> wire = List.of("has", List.of("tags.key", "lower", List.of("'Foo'")));

        // When
        FunctionCall call = (FunctionCall) ConditionParser.parse(wire);

        // Then
        assertThat(call.getArgs()).containsExactly(
            Term.of("tags.key"),
            new FunctionCall("lower", List.of(Term.of("'Foo'"))));
    }

    @Test
    @DisplayName("should parse a list of conditions as an OR group")
    void shouldParseGroup() {
        Expr parsed = ConditionParser.parse(List.of(
            List.of("environment", "=", "prod"),
            List.of("environment", "=", "staging")));

        assertThat(parsed).isEqualTo(ExprGroup.of(
            Comparison.of("environment", "=", "prod"),
            Comparison.of("environment", "=", "staging")));
    }

    @Test
    @DisplayName("should reject unsafe function names")
    void shouldRejectUnsafeFunctionNames() {
        assertThatThrownBy(() -> ConditionParser.parse(List.of("count;DROP", List.of("x"))))
            .isInstanceOf(QueryGatewayException.class)
            .hasMessageContaining("Unsafe function name");
    }

    @Test
    @DisplayName("should reject unsafe names nested in arguments")
    void shouldRejectUnsafeNestedNames() {
        assertThatThrownBy(() -> ConditionParser.parse(
            List.of("has", List.of("tags.key", "lower)--", List.of("'x'")))))
            .isInstanceOf(QueryGatewayException.class)
            .hasMessageContaining("lower)--");
    }

    @Test
    @DisplayName("should reject malformed conditions")
    void shouldRejectMalformedConditions() {
        assertThatThrownBy(() -> ConditionParser.parse("environment"))
            .isInstanceOf(QueryGatewayException.class)
            .hasMessageContaining("Unexpected condition format");
        assertThatThrownBy(() -> ConditionParser.parse(List.of("environment", "=")))
            .isInstanceOf(QueryGatewayException.class);
        assertThatThrownBy(() -> ConditionParser.parse(List.of()))
            .isInstanceOf(QueryGatewayException.class);
    }
}
