package com.strata.query;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Test suite for QueryMetrics
 * Tests all metric tracking functionality including:
 * - Query execution counters and latency
 * - Result size tracking
 * - Per-referrer cache hit rates
 * - Transport retries and invalid referrers
 */
@DisplayName("QueryMetrics Tests")
class QueryMetricsTest {

    private QueryMetrics queryMetrics;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryMetrics = new QueryMetrics(meterRegistry);
    }

    @Test
    @DisplayName("Should initialize all metrics on startup")
    void shouldInitializeAllMetrics() {
        assertThat(queryMetrics.getQueriesExecuted()).isNotNull();
        assertThat(queryMetrics.getQueriesFailed()).isNotNull();
        assertThat(queryMetrics.getQueryExecutionLatency()).isNotNull();
        assertThat(queryMetrics.getResultSize()).isNotNull();
    }

    @Test
    @DisplayName("Should count executed and failed queries")
    void shouldCountQueries() {
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryFailed();

        assertThat(queryMetrics.getQueriesExecuted().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getQueriesFailed().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record latency from a started sample")
    void shouldRecordLatency() {
        Timer.Sample sample = queryMetrics.startQueryTimer();

        queryMetrics.recordQueryLatency(sample);

        assertThat(queryMetrics.getQueryExecutionLatency().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should record result sizes")
    void shouldRecordResultSizes() {
        queryMetrics.recordResultSize(10);
        queryMetrics.recordResultSize(30);

        assertThat(queryMetrics.getResultSize().count()).isEqualTo(2);
        assertThat(queryMetrics.getResultSize().mean()).isEqualTo(20.0, within(0.01));
    }

    @Test
    @DisplayName("Should calculate cache hit rate across referrers")
    void shouldCalculateCacheHitRate() {
        queryMetrics.recordCacheHit("api.a");
        queryMetrics.recordCacheHit("api.b");
        queryMetrics.recordCacheHit(null);
        queryMetrics.recordCacheMiss("api.a");

        assertThat(queryMetrics.getCacheHitRate()).isEqualTo(75.0, within(0.01));
        assertThat(meterRegistry.get("strata.query.cache.hits").tag("referrer", "api.a").counter().count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.get("strata.query.cache.hits").tag("referrer", "unknown").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return zero hit rate without cache operations")
    void shouldReturnZeroHitRate() {
        assertThat(queryMetrics.getCacheHitRate()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should tag retries with method and path")
    void shouldTagRetries() {
        queryMetrics.recordClientRetry("POST", "/events/query");
        queryMetrics.recordClientRetry("POST", "/events/query");

        assertThat(meterRegistry.get("strata.client.retry")
            .tag("method", "POST").tag("path", "/events/query").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should count api requests and invalid referrers")
    void shouldCountApiRequestsAndInvalidReferrers() {
        queryMetrics.recordApiRequest("api.a");
        queryMetrics.recordInvalidReferrer("bad referrer");

        assertThat(meterRegistry.get("strata.query.api").tag("referrer", "api.a").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("strata.query.referrer.invalid").counter().count()).isEqualTo(1.0);
    }
}
