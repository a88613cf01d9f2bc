package com.strata.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Organization a query runs under and the scoping parameters
 * ({@code project}, {@code organization}) to send with it.
 */
public class QueryScope {
    private final long organizationId;
    private final Map<String, Object> params;

    public QueryScope(long organizationId, Map<String, Object> params) {
        this.organizationId = organizationId;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public long getOrganizationId() {
        return organizationId;
    }

    public Map<String, Object> getParams() {
        return params;
    }
}
