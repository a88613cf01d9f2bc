package com.strata.storage.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Key-value store for serialized query results.
 *
 * Implementations are best effort: a failing store behaves like an empty one
 * and never fails the query that uses it.
 */
public interface QueryCacheStore {

    /**
     * @return the cached values for the keys that are present
     */
    Map<String, String> getMany(Collection<String> keys);

    void set(String key, String value, Duration ttl);
}
