package com.strata.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResultNester")
class ResultNesterTest {

    private static final List<Map<String, Object>> ROWS = List.of(
        Map.of("a", 1, "b", 2, "v", 10, "w", 1),
        Map.of("a", 1, "b", 3, "v", 20, "w", 2),
        Map.of("a", 2, "b", 2, "v", 30, "w", 3));

    @Test
    @DisplayName("should nest rows by each group column with scalar leaves")
    void shouldNestByGroups() {
        Object nested = ResultNester.nest(ROWS, List.of("a", "b"), List.of("v"));

        assertThat(nested).isEqualTo(Map.of(
            1, Map.of(2, 10, 3, 20),
            2, Map.of(2, 30)));
    }

    @Test
    @DisplayName("should keep a map of aggregates when there are several")
    void shouldKeepAggregateMaps() {
        Object nested = ResultNester.nest(ROWS, List.of("a"), List.of("v", "w"));

        // Only the first row of each bucket is kept
        assertThat(nested).isEqualTo(Map.of(
            1, Map.of("v", 10, "w", 1),
            2, Map.of("v", 30, "w", 3)));
    }

    @Test
    @DisplayName("should return the aggregate of the first row without groups")
    void shouldReturnScalarWithoutGroups() {
        assertThat(ResultNester.nest(ROWS, List.of(), List.of("v"))).isEqualTo(10);
    }

    @Test
    @DisplayName("should return null for no rows and no groups")
    void shouldReturnNullForNoRows() {
        assertThat(ResultNester.nest(List.of(), List.of(), List.of("v"))).isNull();
        assertThat(ResultNester.nest(List.of(), List.of("a"), List.of("v"))).isEqualTo(Map.of());
    }

    @Test
    @DisplayName("should preserve the order of first appearance")
    void shouldPreserveOrder() {
        @SuppressWarnings("unchecked")
        Map<Object, Object> nested = (Map<Object, Object>) ResultNester.nest(
            List.of(Map.of("a", "z", "v", 1), Map.of("a", "m", "v", 2), Map.of("a", "z", "v", 3)),
            List.of("a"), List.of("v"));

        assertThat(nested.keySet()).containsExactly("z", "m");
    }
}
