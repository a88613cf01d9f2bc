package com.strata.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request options that win over everything else in the outgoing payload,
 * such as {@code consistent}. Immutable; {@link #merge} returns a new value.
 */
public final class QueryOverrides {

    public static final String CONSISTENT = "consistent";

    private static final QueryOverrides NONE = new QueryOverrides(Collections.emptyMap());

    private final Map<String, Object> options;

    private QueryOverrides(Map<String, Object> options) {
        this.options = options;
    }

    public static QueryOverrides none() {
        return NONE;
    }

    public static QueryOverrides of(Map<String, ?> options) {
        return options.isEmpty() ? NONE : new QueryOverrides(Collections.unmodifiableMap(new LinkedHashMap<>(options)));
    }

    public static QueryOverrides consistent(boolean consistent) {
        return of(Map.of(CONSISTENT, consistent));
    }

    /**
     * @return overrides holding both sets of options, {@code other} winning on conflicts
     */
    public QueryOverrides merge(QueryOverrides other) {
        if (other.options.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(options);
        merged.putAll(other.options);
        return new QueryOverrides(Collections.unmodifiableMap(merged));
    }

    public boolean contains(String key) {
        return options.containsKey(key);
    }

    public Object get(String key) {
        return options.get(key);
    }

    public Boolean getConsistent() {
        Object value = options.get(CONSISTENT);
        return value instanceof Boolean ? (Boolean) value : null;
    }

    public Map<String, Object> asMap() {
        return options;
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryOverrides)) return false;
        return options.equals(((QueryOverrides) o).options);
    }

    @Override
    public int hashCode() {
        return options.hashCode();
    }

    @Override
    public String toString() {
        return "QueryOverrides" + options;
    }
}
