package com.strata.query.error;

/**
 * The query would exceed the backend's memory limit.
 */
public class QueryMemoryLimitExceededException extends QueryExecutionException {

    public QueryMemoryLimitExceededException(String message, Integer code) {
        super(message, code);
    }
}
