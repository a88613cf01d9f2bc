package com.strata.query.error;

/**
 * A column referenced by the query does not exist.
 */
public class QueryMissingColumnException extends QueryExecutionException {

    public QueryMissingColumnException(String message, Integer code) {
        super(message, code);
    }
}
