package com.strata.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.time.Duration;

/**
 * Metrics collector for gateway queries.
 * Tracks backend round trips, their latency and outcome, result sizes, cache
 * hit rates per referrer and transport retries. Recording never throws.
 */
@Component
public class QueryMetrics {

    private static final Logger log = LoggerFactory.getLogger(QueryMetrics.class);

    static final String UNKNOWN_REFERRER = "unknown";

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Timer queryExecutionLatency;
    private DistributionSummary resultSize;

    public QueryMetrics() {
    }

    public QueryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        init();
    }

    @PostConstruct
    public void init() {
        queriesExecuted = Counter.builder("strata.query.executed")
            .description("Total number of backend queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("strata.query.failed")
            .description("Total number of backend queries that failed")
            .register(meterRegistry);

        queryExecutionLatency = Timer.builder("strata.query.execution.latency")
            .description("Latency of one backend round trip")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("strata.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        safely(() -> queriesExecuted.increment());
    }

    public void recordQueryFailed() {
        safely(() -> queriesFailed.increment());
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        safely(() -> sample.stop(queryExecutionLatency));
    }

    public void recordResultSize(long size) {
        safely(() -> resultSize.record(size));
    }

    public void recordCacheHit(String referrer) {
        safely(() -> Counter.builder("strata.query.cache.hits")
            .description("Query cache hits")
            .tag("referrer", referrerTag(referrer))
            .register(meterRegistry)
            .increment());
    }

    public void recordCacheMiss(String referrer) {
        safely(() -> Counter.builder("strata.query.cache.misses")
            .description("Query cache misses")
            .tag("referrer", referrerTag(referrer))
            .register(meterRegistry)
            .increment());
    }

    /**
     * One structured request batch entering the gateway.
     */
    public void recordApiRequest(String referrer) {
        safely(() -> Counter.builder("strata.query.api")
            .tag("referrer", referrerTag(referrer))
            .register(meterRegistry)
            .increment());
    }

    public void recordClientRetry(String method, String path) {
        safely(() -> Counter.builder("strata.client.retry")
            .description("Transport retries after connection failures")
            .tag("method", method)
            .tag("path", path)
            .register(meterRegistry)
            .increment());
    }

    public void recordInvalidReferrer(String referrer) {
        safely(() -> Counter.builder("strata.query.referrer.invalid")
            .tag("referrer", referrerTag(referrer))
            .register(meterRegistry)
            .increment());
    }

    /**
     * Cache hit rate as a percentage across all referrers
     * @return cache hit rate (0-100) or 0 if no cache operations
     */
    public double getCacheHitRate() {
        double hits = meterRegistry.find("strata.query.cache.hits").counters().stream()
            .mapToDouble(Counter::count).sum();
        double misses = meterRegistry.find("strata.query.cache.misses").counters().stream()
            .mapToDouble(Counter::count).sum();
        double total = hits + misses;

        if (total == 0) {
            return 0.0;
        }

        return (hits / total) * 100.0;
    }

    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    private static String referrerTag(String referrer) {
        return referrer != null ? referrer : UNKNOWN_REFERRER;
    }

    private static void safely(Runnable recording) {
        try {
            recording.run();
        } catch (RuntimeException e) {
            log.debug("Failed to record metric: {}", e.getMessage());
        }
    }
}
