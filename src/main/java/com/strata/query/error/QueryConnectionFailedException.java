package com.strata.query.error;

/**
 * The backend could not reach its storage nodes to run the query.
 */
public class QueryConnectionFailedException extends QueryExecutionException {

    public QueryConnectionFailedException(String message, Integer code) {
        super(message, code);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
