package com.strata.query.execution;

/**
 * Query language of a backend request; decides the endpoint it is posted to.
 */
public enum QueryLanguage {
    SNQL("snql"),
    MQL("mql"),
    /** JSON query bodies built from a {@link com.strata.query.QueryIntent}. */
    LEGACY("query");

    private final String endpoint;

    QueryLanguage(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
