package com.strata.query.error;

/**
 * The generated query exceeds the maximum length the backend accepts.
 */
public class QuerySizeExceededException extends QueryExecutionException {

    public QuerySizeExceededException(String message, Integer code) {
        super(message, code);
    }
}
