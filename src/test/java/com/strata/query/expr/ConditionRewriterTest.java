package com.strata.query.expr;

import com.strata.domain.Dataset;
import com.strata.query.column.ColumnResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConditionRewriter")
class ConditionRewriterTest {

    private ConditionRewriter rewriter;

    @BeforeEach
    void setUp() {
        rewriter = ConditionRewriter.forResolver(ColumnResolver.forDataset(Dataset.EVENTS));
    }

    private Object rewriteWire(Object wire) {
        return ConditionWriter.write(rewriter.rewrite(ConditionParser.parse(wire)));
    }

    @Test
    @DisplayName("should resolve columns inside comparison functions and keep quoted literals")
    void shouldRewriteComparisonFunction() {
        Object rewritten = rewriteWire(List.of("equals", List.of("myTag", "'x'")));

        assertThat(rewritten).isEqualTo(List.of("equals", List.of("tags[myTag]", "'x'")));
    }

    @Test
    @DisplayName("should quote bare string literals of comparison functions")
    void shouldQuoteBareLiterals() {
        Object rewritten = rewriteWire(List.of("notEquals", List.of("release", "1.0")));

        assertThat(rewritten).isEqualTo(List.of("notEquals", List.of("tags[sentry:release]", "'1.0'")));
    }

    @Test
    @DisplayName("should resolve only the column of a leaf comparison")
    void shouldResolveLeafColumnOnly() {
        Object rewritten = rewriteWire(List.of("user.email", "=", "user.email"));

        assertThat(rewritten).isEqualTo(List.of("email", "=", "user.email"));
    }

    @Test
    @DisplayName("should resolve every argument of other functions")
    void shouldResolveAllArgumentsOfOtherFunctions() {
        Object rewritten = rewriteWire(List.of(List.of("coalesce", List.of("user.email", "user.username")), "=", "a"));

        assertThat(rewritten).isEqualTo(List.of(List.of("coalesce", List.of("email", "username")), "=", "a"));
    }

    @Test
    @DisplayName("should rewrite groups in order and leave the input untouched")
    void shouldRewriteGroupsInOrder() {
        // Given
        Expr group = ConditionParser.parse(List.of(
            List.of("issue.id", "=", 1),
            List.of("platform.name", "=", "python")));

        // When
        Expr rewritten = rewriter.rewrite(group);

        // Then
        assertThat(ConditionWriter.write(rewritten)).isEqualTo(List.of(
            List.of("group_id", "=", 1),
            List.of("platform", "=", "python")));
        assertThat(((ExprGroup) group).getChildren().get(0)).isEqualTo(Comparison.of("issue.id", "=", 1));
    }

    @Test
    @DisplayName("should keep function aliases")
    void shouldKeepAliases() {
        Expr call = ConditionParser.parseColumn(List.of("uniq", List.of("user"), "users"));

        Object rewritten = ConditionWriter.write(rewriter.rewrite(call));

        assertThat(rewritten).isEqualTo(List.of("uniq", List.of("tags[sentry:user]"), "users"));
    }

    @Test
    @DisplayName("should use a custom resolver")
    void shouldUseCustomResolver() {
        ConditionRewriter upper = new ConditionRewriter(column -> column instanceof String
            ? ((String) column).toUpperCase() : column);

        Expr rewritten = upper.rewrite(Comparison.of("title", "LIKE", "%x%"));

        assertThat(rewritten).isEqualTo(Comparison.of("TITLE", "LIKE", "%x%"));
    }

    @Test
    @DisplayName("should format literals")
    void shouldFormatLiterals() {
        assertThat(ConditionRewriter.literal("abc")).isEqualTo("'abc'");
        assertThat(ConditionRewriter.literal("'abc'")).isEqualTo("'abc'");
        assertThat(ConditionRewriter.literal(5)).isEqualTo(5);
        assertThat(ConditionRewriter.literal(LocalDateTime.of(2024, 1, 2, 3, 4, 5)))
            .isEqualTo("'2024-01-02T03:04:05'");
        assertThat(ConditionRewriter.literal(OffsetDateTime.of(2024, 1, 2, 5, 4, 5, 0, ZoneOffset.ofHours(2))))
            .isEqualTo("'2024-01-02T03:04:05'");
    }
}
