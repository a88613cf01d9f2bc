package com.strata.query.error;

/**
 * Rejected because too many queries are running on the backend at once.
 */
public class QueryTooManySimultaneousException extends QueryExecutionException {

    public QueryTooManySimultaneousException(String message, Integer code) {
        super(message, code);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
