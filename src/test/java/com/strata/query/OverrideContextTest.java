package com.strata.query;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for OverrideContext.
 *
 * Tests verify:
 * - Nested scopes layer and restore
 * - Thread isolation
 * - Misuse across threads
 */
@DisplayName("OverrideContext")
class OverrideContextTest {

    @AfterEach
    void tearDown() {
        assertThat(OverrideContext.current().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should have no overrides outside a scope")
    void shouldBeEmptyByDefault() {
        assertThat(OverrideContext.current()).isEqualTo(QueryOverrides.none());
    }

    @Test
    @DisplayName("should layer nested scopes and restore them on close")
    void shouldLayerNestedScopes() {
        try (OverrideContext.Scope outer = OverrideContext.open(Map.of("consistent", true, "turbo", false))) {
            assertThat(OverrideContext.current().getConsistent()).isTrue();

            try (OverrideContext.Scope inner = OverrideContext.open(Map.of("consistent", false))) {
                // Then: inner wins, outer options stay visible
                assertThat(OverrideContext.current().getConsistent()).isFalse();
                assertThat(OverrideContext.current().get("turbo")).isEqualTo(false);
            }

            assertThat(OverrideContext.current().getConsistent()).isTrue();
        }
        assertThat(OverrideContext.current().contains("consistent")).isFalse();
    }

    @Test
    @DisplayName("should tolerate closing a scope twice")
    void shouldTolerateDoubleClose() {
        OverrideContext.Scope scope = OverrideContext.open(QueryOverrides.consistent(true));

        scope.close();
        scope.close();

        assertThat(OverrideContext.current().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should isolate overrides between threads")
    void shouldIsolateThreads() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (OverrideContext.Scope scope = OverrideContext.open(QueryOverrides.consistent(true))) {
            // When
            QueryOverrides seenElsewhere = executor.submit(OverrideContext::current).get(5, TimeUnit.SECONDS);

            // Then
            assertThat(seenElsewhere.isEmpty()).isTrue();
            assertThat(OverrideContext.current().getConsistent()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("should refuse to close a scope on another thread")
    void shouldRefuseForeignClose() throws Exception {
        OverrideContext.Scope scope = OverrideContext.open(QueryOverrides.consistent(true));
        CountDownLatch done = new CountDownLatch(1);
        try {
            CompletableFuture<Throwable> failure = CompletableFuture.supplyAsync(() -> {
                try {
                    scope.close();
                    return null;
                } catch (IllegalStateException e) {
                    return e;
                } finally {
                    done.countDown();
                }
            });

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
        } finally {
            scope.close();
        }
    }

    @Test
    @DisplayName("should merge overrides with the later value winning")
    void shouldMergeOverrides() {
        QueryOverrides merged = QueryOverrides.consistent(false)
            .merge(QueryOverrides.of(Map.of("consistent", true, "limit", 5)));

        assertThat(merged.asMap()).containsEntry("consistent", true).containsEntry("limit", 5);
        assertThat(QueryOverrides.none().merge(QueryOverrides.none()).isEmpty()).isTrue();
        assertThatThrownBy(() -> merged.asMap().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }
}
