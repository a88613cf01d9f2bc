package com.strata.query;

import com.strata.domain.Dataset;
import com.strata.query.execution.BackendRequest;
import com.strata.query.execution.PreparedQuery;
import com.strata.query.execution.QueryLanguage;
import com.strata.query.expr.Comparison;
import com.strata.query.translate.TranslatorFactory;
import com.strata.storage.EntityCatalog;
import com.strata.storage.RetentionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests QueryParamsBuilder against real translators, scoping and windowing,
 * with only the entity catalog and retention mocked.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("QueryParamsBuilder")
class QueryParamsBuilderTest {

    @Mock
    private EntityCatalog catalog;

    @Mock
    private RetentionPolicy retentionPolicy;

    private QueryParamsBuilder builder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        builder = new QueryParamsBuilder(
            new TranslatorFactory(catalog),
            new QueryScopeResolver(catalog),
            new TimeWindowResolver(retentionPolicy, catalog, clock));
        lenient().when(catalog.organizationIdForProject(anyLong())).thenReturn(42L);
        lenient().when(retentionPolicy.retentionDays(anyLong())).thenReturn(90);
    }

    private static QueryIntent.Builder eventsIntent() {
        return QueryIntent.builder()
            .dataset(Dataset.EVENTS)
            .start(LocalDateTime.of(2024, 5, 1, 0, 0))
            .end(LocalDateTime.of(2024, 5, 2, 0, 0))
            .filterKey("project_id", List.of(3));
    }

    @Test
    @DisplayName("should assemble the full legacy payload")
    void shouldAssemblePayload() {
        // Given
        when(catalog.environmentNames(anyCollection())).thenReturn(Map.of(1L, "production"));
        QueryIntent intent = eventsIntent()
            .groupBy(List.of("environment"))
            .filterKey("environment", List.of(1L))
            .wireConditions(List.of(List.of("type", "=", "error")))
            .aggregation("count()", "", "aggregate")
            .rollup(3600)
            .limit(10)
            .option("turbo", true)
            .build();

        // When
        PreparedQuery prepared = builder.prepare(intent, "api.test", QueryOverrides.consistent(true));
        BackendRequest request = prepared.getRequest();
        Map<String, Object> payload = request.getQuery();

        // Then
        assertThat(request.getLanguage()).isEqualTo(QueryLanguage.LEGACY);
        assertThat(request.getPath()).isEqualTo("/events/query");
        assertThat(payload).containsEntry("dataset", "events")
            .containsEntry("turbo", true)
            .containsEntry("limit", 10)
            .containsEntry("project", List.of(3L))
            .containsEntry("from_date", "2024-05-01T00:00:00")
            .containsEntry("to_date", "2024-05-02T00:00:00")
            .containsEntry("groupby", List.of("environment"))
            .containsEntry("granularity", 3600)
            .containsEntry("tenant_ids", Map.of("referrer", "api.test"))
            .containsEntry("consistent", true)
            .doesNotContainKeys("offset", "totals", "selected_columns", "having", "orderby");
        assertThat(payload.get("conditions")).isEqualTo(List.of(
            List.of("type", "=", "error"),
            List.of("project_id", "IN", List.of(3)),
            List.of("environment", "IN", List.of("production"))));
        assertThat(payload.get("aggregations")).isEqualTo(List.of(List.of("count()", "", "aggregate")));
    }

    @Test
    @DisplayName("should filter on IS NULL when the only key is null")
    void shouldFilterOnIsNull() {
        // Given: the default environment has no name
        Map<Long, String> names = new HashMap<>();
        names.put(5L, null);
        when(catalog.environmentNames(anyCollection())).thenReturn(names);
        QueryIntent intent = eventsIntent().filterKey("environment", List.of(5L)).build();

        // When
        Map<String, Object> payload = builder.prepare(intent, null, QueryOverrides.none()).getRequest().getQuery();

        // Then
        assertThat(payload.get("conditions")).isEqualTo(List.of(
            List.of("project_id", "IN", List.of(3)),
            Arrays.asList("environment", "IS NULL", null)));
        assertThat(payload).doesNotContainKeys("tenant_ids", "consistent");
    }

    @Test
    @DisplayName("should add no filter when no environment key is an id")
    void shouldDropFilterWithoutIds() {
        // Given
        QueryIntent intent = eventsIntent()
            .filterKey("environment", Arrays.asList((Object) null))
            .filterKey("tags[sentry:release]", List.of("not-an-id"))
            .build();

        // When
        Map<String, Object> payload = builder.prepare(intent, null, QueryOverrides.none()).getRequest().getQuery();

        // Then
        assertThat(payload.get("conditions")).isEqualTo(List.of(List.of("project_id", "IN", List.of(3))));
        verify(catalog, never()).environmentNames(anyCollection());
        verify(catalog, never()).releaseVersions(anyCollection());
    }

    @Test
    @DisplayName("should default the dataset to events")
    void shouldDefaultDataset() {
        QueryIntent intent = QueryIntent.builder().filterKey("project_id", List.of(3)).build();

        PreparedQuery prepared = builder.prepare(intent, null, QueryOverrides.none());

        assertThat(prepared.getRequest().getDataset()).isEqualTo("events");
        assertThat(prepared.getRequest().getQuery()).containsEntry("from_date", "2024-03-03T12:00:00");
    }

    @Test
    @DisplayName("should let overrides win over the query and merge the referrer into tenant ids")
    void shouldApplyOverridesLast() {
        // Given
        QueryIntent intent = eventsIntent()
            .option("tenant_ids", Map.of("organization_id", 42))
            .option("consistent", false)
            .build();
        QueryOverrides overrides = QueryOverrides.consistent(true).merge(QueryOverrides.of(Map.of("limit", 1)));

        // When
        Map<String, Object> payload = builder.prepare(intent, "api.test", overrides).getRequest().getQuery();

        // Then
        assertThat(payload).containsEntry("consistent", true).containsEntry("limit", 1);
        assertThat(payload.get("tenant_ids")).isEqualTo(Map.of("organization_id", 42, "referrer", "api.test"));
    }

    @Test
    @DisplayName("should translate result rows with the chain built for the query")
    void shouldReturnTranslatorChain() {
        when(catalog.environmentNames(anyCollection())).thenReturn(Map.of(1L, "production"));
        QueryIntent intent = eventsIntent().filterKey("environment", List.of(1L)).build();

        PreparedQuery prepared = builder.prepare(intent, null, QueryOverrides.none());
        Map<String, Object> row = new HashMap<>(Map.of("environment", "production"));

        assertThat(prepared.getTranslators().reverse(row)).containsEntry("environment", 1L);
    }

    @Test
    @DisplayName("should write having and selected columns")
    void shouldWritePassthroughFields() {
        QueryIntent intent = eventsIntent()
            .selectedColumns(List.of("title", List.of("uniq", List.of("user"), "users")))
            .having(List.of(Comparison.of("users", ">", 1)))
            .orderBy(List.of("-users"))
            .totals(true)
            .build();

        Map<String, Object> payload = builder.prepare(intent, null, QueryOverrides.none()).getRequest().getQuery();

        assertThat(payload.get("selected_columns")).isEqualTo(List.of("title", List.of("uniq", List.of("user"), "users")));
        assertThat(payload.get("having")).isEqualTo(List.of(List.of("users", ">", 1)));
        assertThat(payload).containsEntry("orderby", List.of("-users")).containsEntry("totals", true);
    }
}
