package com.strata.query.error;

/**
 * The query ran, or would run, longer than the backend's execution time limit.
 */
public class QueryExecutionTimeMaximumException extends QueryExecutionException {

    public QueryExecutionTimeMaximumException(String message, Integer code) {
        super(message, code);
    }
}
