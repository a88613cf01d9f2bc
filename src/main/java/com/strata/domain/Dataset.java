package com.strata.domain;

import java.util.Arrays;

/**
 * Logical data sources exposed by the analytical backend.
 *
 * Each dataset has its own column namespace (see
 * {@link com.strata.query.column.DatasetColumns}) and a scoping family that
 * decides how the owning organization is derived from a query.
 */
public enum Dataset {

    EVENTS("events", ScopingFamily.PROJECT),
    TRANSACTIONS("transactions", ScopingFamily.PROJECT),
    DISCOVER("discover", ScopingFamily.PROJECT),
    SESSIONS("sessions", ScopingFamily.PROJECT),
    ISSUE_PLATFORM("search_issues", ScopingFamily.PROJECT),
    REPLAYS("replays", ScopingFamily.PROJECT),
    OUTCOMES("outcomes", ScopingFamily.ORGANIZATION),
    OUTCOMES_RAW("outcomes_raw", ScopingFamily.ORGANIZATION),
    METRICS("metrics", ScopingFamily.NONE),
    PERFORMANCE_METRICS("generic_metrics", ScopingFamily.NONE),
    METRICS_SUMMARIES("metrics_summaries", ScopingFamily.NONE),
    SPANS_INDEXED("spans", ScopingFamily.NONE);

    /**
     * How a query against the dataset is attributed to an organization.
     */
    public enum ScopingFamily {
        /** Organization is resolved through the queried project ids. */
        PROJECT,
        /** Organization is named directly, or reached via projects or project keys. */
        ORGANIZATION,
        /** The legacy query path has no scoping strategy for this dataset. */
        NONE
    }

    private final String value;
    private final ScopingFamily scopingFamily;

    Dataset(String value, ScopingFamily scopingFamily) {
        this.value = value;
        this.scopingFamily = scopingFamily;
    }

    /**
     * Name of the dataset on the wire, also the first segment of the request path.
     */
    public String getValue() {
        return value;
    }

    public ScopingFamily getScopingFamily() {
        return scopingFamily;
    }

    public static Dataset fromValue(String value) {
        return Arrays.stream(values())
            .filter(dataset -> dataset.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown dataset: " + value));
    }
}
