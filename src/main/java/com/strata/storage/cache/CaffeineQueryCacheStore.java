package com.strata.storage.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * In-process query cache. Each entry expires after the TTL it was written with.
 */
@Component
@ConditionalOnProperty(name = "strata.gateway.cache.store", havingValue = "local", matchIfMissing = true)
public class CaffeineQueryCacheStore implements QueryCacheStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineQueryCacheStore.class);

    private final Cache<String, Entry> cache;

    public CaffeineQueryCacheStore(@Value("${strata.gateway.cache.max-size:1000}") long maxSize) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttl.toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttl.toNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .recordStats()
            .build();

        log.info("Local query cache initialized (maxSize={})", maxSize);
    }

    @Override
    public Map<String, String> getMany(Collection<String> keys) {
        Map<String, Entry> entries = cache.getAllPresent(keys);
        Map<String, String> values = new HashMap<>(entries.size());
        entries.forEach((key, entry) -> values.put(key, entry.value));
        return values;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl));
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class Entry {
        private final String value;
        private final Duration ttl;

        private Entry(String value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }
}
