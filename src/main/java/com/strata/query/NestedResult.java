package com.strata.query;

import java.util.Map;

/**
 * Result of {@link QueryGateway#query}: rows nested by group, and the totals
 * row when totals were requested.
 */
public class NestedResult {
    private final Object groups;
    private final Map<String, Object> totals;

    public NestedResult(Object groups, Map<String, Object> totals) {
        this.groups = groups;
        this.totals = totals;
    }

    /**
     * Nested groups; a scalar, a map, or null when there were no rows.
     */
    public Object getGroups() {
        return groups;
    }

    public Map<String, Object> getTotals() {
        return totals;
    }
}
