package com.strata.storage.cache;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Query cache shared across gateway instances, backed by Redis.
 *
 * Calls go through a circuit breaker so an unavailable Redis costs one fast
 * failure per call instead of a connect timeout.
 */
@Component
@ConditionalOnProperty(name = "strata.gateway.cache.store", havingValue = "redis")
public class RedisQueryCacheStore implements QueryCacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisQueryCacheStore.class);

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;

    public RedisQueryCacheStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;

        // Opens at 50% failures over the last 10 calls, half-open after 30s
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();

        this.circuitBreaker = CircuitBreaker.of("queryCache", cbConfig);
    }

    @Override
    public Map<String, String> getMany(Collection<String> keys) {
        Map<String, String> found = new HashMap<>();
        if (keys.isEmpty()) {
            return found;
        }
        List<String> orderedKeys = new ArrayList<>(keys);
        try {
            List<String> values = circuitBreaker.executeSupplier(
                () -> redisTemplate.opsForValue().multiGet(orderedKeys));
            if (values != null) {
                for (int i = 0; i < orderedKeys.size() && i < values.size(); i++) {
                    if (values.get(i) != null) {
                        found.put(orderedKeys.get(i), values.get(i));
                    }
                }
            }
        } catch (Exception e) {
            log.warn("Query cache read failed for {} keys: {}", orderedKeys.size(), e.getMessage());
        }
        return found;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            circuitBreaker.executeRunnable(() -> redisTemplate.opsForValue().set(key, value, ttl));
            log.debug("Cached result for key: {} (TTL: {}s)", key, ttl.getSeconds());
        } catch (Exception e) {
            log.warn("Query cache write failed for key {}: {}", key, e.getMessage());
        }
    }

    CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
