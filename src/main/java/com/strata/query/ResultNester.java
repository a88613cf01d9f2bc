package com.strata.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a nested map from result rows: one level per group column, with the
 * aggregate values at the leaves.
 */
public final class ResultNester {

    private ResultNester() {
    }

    /**
     * @return a scalar (one aggregate) or a map of aggregate to value taken from the first
     *         row of the bucket, nested under one map per group column. Empty input yields null.
     */
    public static Object nest(List<Map<String, Object>> rows, List<String> groups, List<String> aggregates) {
        if (groups == null || groups.isEmpty()) {
            if (rows.isEmpty()) {
                return null;
            }
            Map<String, Object> first = rows.get(0);
            if (aggregates.size() == 1) {
                return first.get(aggregates.get(0));
            }
            Map<String, Object> leaf = new LinkedHashMap<>();
            for (String aggregate : aggregates) {
                leaf.put(aggregate, first.get(aggregate));
            }
            return leaf;
        }

        String group = groups.get(0);
        List<String> rest = groups.subList(1, groups.size());
        Map<Object, List<Map<String, Object>>> buckets = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            buckets.computeIfAbsent(row.get(group), key -> new ArrayList<>()).add(row);
        }

        Map<Object, Object> nested = new LinkedHashMap<>();
        buckets.forEach((key, bucket) -> nested.put(key, nest(bucket, rest, aggregates)));
        return nested;
    }
}
