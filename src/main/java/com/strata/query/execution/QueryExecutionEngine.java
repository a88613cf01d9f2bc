package com.strata.query.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.domain.QueryResponse;
import com.strata.query.QueryMetrics;
import com.strata.query.error.ErrorClassifier;
import com.strata.query.error.QueryGatewayException;
import com.strata.storage.cache.QueryCacheStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs prepared queries against the backend and returns their results in the
 * order they were given.
 *
 * This service:
 * - Looks up all cacheable queries with one bulk cache read
 * - Runs a single miss inline, and two or more misses concurrently on a bounded scheduler
 * - Tags every request with the caller's transaction as {@code parent_api}
 * - Classifies failed responses into typed exceptions
 * - Translates every row back to caller identifiers exactly once
 * - Writes misses back to the cache, best effort
 *
 * Each query carries its original position through the pipeline and results
 * are sorted by it, so completion order and the hit/miss split never affect
 * the output order.
 */
@Service
public class QueryExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutionEngine.class);

    /** MDC key holding the name of the caller's transaction. */
    public static final String TRANSACTION_MDC_KEY = "transaction";
    static final String MISSING_PARENT_API = "<missing>";
    static final String UNKNOWN_REFERRER = "<unknown>";

    private final BackendTransport transport;
    private final QueryCacheStore cacheStore;
    private final QueryMetrics metrics;
    private final ObjectMapper objectMapper;
    private final RequestFingerprint fingerprint;
    private final ReferrerValidator referrerValidator;
    private final Scheduler scheduler;
    private final int concurrency;
    private final Duration cacheTtl;
    private final boolean debugQueries;

    public QueryExecutionEngine(
            BackendTransport transport,
            QueryCacheStore cacheStore,
            QueryMetrics metrics,
            ObjectMapper objectMapper,
            ReferrerValidator referrerValidator,
            @Qualifier("queryScheduler") Scheduler scheduler,
            @Value("${strata.gateway.pool-size:10}") int concurrency,
            @Value("${strata.gateway.cache.ttl-seconds:300}") long cacheTtlSeconds,
            @Value("${strata.gateway.debug-queries:false}") boolean debugQueries) {
        this.transport = transport;
        this.cacheStore = cacheStore;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.fingerprint = new RequestFingerprint(objectMapper);
        this.referrerValidator = referrerValidator;
        this.scheduler = scheduler;
        this.concurrency = concurrency;
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);
        this.debugQueries = debugQueries;

        log.info("QueryExecutionEngine initialized (concurrency={}, cacheTtl={}s, debugQueries={})",
            concurrency, cacheTtlSeconds, debugQueries);
    }

    /**
     * Execute queries, blocking until all of them complete.
     *
     * @param queries  queries in caller order
     * @param referrer attribution sent as the {@code referer} header, may be null
     * @param useCache whether results may be served from and written to the cache
     * @return one response per query, index-aligned with {@code queries}
     * @throws QueryGatewayException on the first query that fails
     */
    public List<QueryResponse> executeMany(List<PreparedQuery> queries, String referrer, boolean useCache) {
        referrerValidator.validate(referrer);
        Map<String, String> headers = new LinkedHashMap<>();
        if (referrer != null) {
            headers.put("referer", referrer);
        }

        List<Positioned> results = new ArrayList<>(queries.size());
        List<Pending> toQuery = new ArrayList<>();

        if (useCache) {
            List<String> keys = new ArrayList<>(queries.size());
            for (PreparedQuery query : queries) {
                keys.add(fingerprint.of(query.getRequest()));
            }
            Map<String, String> cached = readCache(keys);
            for (int i = 0; i < queries.size(); i++) {
                QueryResponse hit = decodeCached(cached.get(keys.get(i)));
                if (hit != null) {
                    metrics.recordCacheHit(referrer);
                    results.add(new Positioned(i, hit, null));
                } else {
                    metrics.recordCacheMiss(referrer);
                    toQuery.add(new Pending(i, queries.get(i), keys.get(i)));
                }
            }
            log.debug("Query cache: {} hits, {} misses", results.size(), toQuery.size());
        } else {
            for (int i = 0; i < queries.size(); i++) {
                toQuery.add(new Pending(i, queries.get(i), null));
            }
        }

        if (!toQuery.isEmpty()) {
            for (Positioned fetched : dispatch(toQuery, headers)) {
                if (fetched.cacheKey != null) {
                    writeCache(fetched.cacheKey, fetched.response);
                }
                results.add(fetched);
            }
        }

        results.sort(Comparator.comparingInt(p -> p.position));
        List<QueryResponse> responses = new ArrayList<>(results.size());
        for (Positioned result : results) {
            responses.add(result.response);
        }
        return responses;
    }

    private List<Positioned> dispatch(List<Pending> toQuery, Map<String, String> headers) {
        String parentApi = MDC.get(TRANSACTION_MDC_KEY);
        String parent = parentApi != null ? parentApi : MISSING_PARENT_API;

        if (toQuery.size() == 1) {
            return List.of(execute(toQuery.get(0), headers, parent).block());
        }

        log.debug("Dispatching {} queries with concurrency {}", toQuery.size(), concurrency);
        List<Positioned> fetched = Flux.fromIterable(toQuery)
            .flatMap(pending -> execute(pending, headers, parent).subscribeOn(scheduler), concurrency)
            .collectList()
            .block();
        return fetched != null ? fetched : List.of();
    }

    private Mono<Positioned> execute(Pending pending, Map<String, String> headers, String parentApi) {
        return Mono.defer(() -> {
            String referrer = headers.getOrDefault("referer", UNKNOWN_REFERRER);
            BackendRequest request = pending.query.getRequest().withParentApi(parentApi);
            if (debugQueries) {
                request = request.withDebug(true);
                log.info("{}.body: {}", referrer, request.toBody());
            }
            BackendRequest sent = request;

            metrics.recordQueryExecuted();
            Timer.Sample sample = metrics.startQueryTimer();
            return transport.send(sent, headers)
                .map(response -> new Positioned(pending.position, decode(pending.query, sent, response, referrer), pending.cacheKey))
                .doOnSuccess(result -> {
                    metrics.recordQueryLatency(sample);
                    metrics.recordResultSize(result.response.getData().size());
                })
                .doOnError(e -> {
                    metrics.recordQueryLatency(sample);
                    metrics.recordQueryFailed();
                });
        });
    }

    QueryResponse decode(PreparedQuery query, BackendRequest request, BackendResponse response, String referrer) {
        JsonNode body;
        try {
            body = objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            body = null;
        }
        if (body == null || !body.isObject()) {
            if (response.getStatus() != 200) {
                log.error("Invalid JSON in backend error response (status {}): {}", response.getStatus(), response.getBody());
            }
            throw ErrorClassifier.classifyUnparseable(response.getStatus(), response.getBody());
        }

        if (debugQueries) {
            if (body.hasNonNull("sql")) {
                log.info("{}.sql:\n {}", referrer, body.get("sql").asText());
            }
            if (body.hasNonNull("error")) {
                log.info("{}.err: {}", referrer, body.get("error"));
            }
        }

        if (response.getStatus() != 200) {
            log.warn("Backend query failed with status {}: {}", response.getStatus(), request);
            throw ErrorClassifier.classify(response.getStatus(), body);
        }

        QueryResponse result;
        try {
            result = objectMapper.treeToValue(body, QueryResponse.class);
        } catch (JsonProcessingException e) {
            throw ErrorClassifier.classifyUnparseable(response.getStatus(), response.getBody());
        }
        List<Map<String, Object>> rows = result.getData() != null ? result.getData() : new ArrayList<>();
        List<Map<String, Object>> translated = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            translated.add(query.getTranslators().reverse(row));
        }
        result.setData(translated);
        if (result.getMeta() == null) {
            result.setMeta(new ArrayList<>());
        }
        return result;
    }

    private Map<String, String> readCache(List<String> keys) {
        try {
            return cacheStore.getMany(keys);
        } catch (RuntimeException e) {
            log.warn("Query cache read failed: {}", e.getMessage());
            return Map.of();
        }
    }

    private QueryResponse decodeCached(String cached) {
        if (cached == null) {
            return null;
        }
        try {
            QueryResponse response = objectMapper.readValue(cached, QueryResponse.class);
            response.setCached(true);
            return response;
        } catch (JsonProcessingException e) {
            log.warn("Discarding undecodable cache entry: {}", e.getMessage());
            return null;
        }
    }

    private void writeCache(String key, QueryResponse response) {
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(response), cacheTtl);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Query cache write failed for key {}: {}", key, e.getMessage());
        }
    }

    private static final class Pending {
        private final int position;
        private final PreparedQuery query;
        private final String cacheKey;

        private Pending(int position, PreparedQuery query, String cacheKey) {
            this.position = position;
            this.query = query;
            this.cacheKey = cacheKey;
        }
    }

    private static final class Positioned {
        private final int position;
        private final QueryResponse response;
        private final String cacheKey;

        private Positioned(int position, QueryResponse response, String cacheKey) {
            this.position = position;
            this.response = response;
            this.cacheKey = cacheKey;
        }
    }
}
