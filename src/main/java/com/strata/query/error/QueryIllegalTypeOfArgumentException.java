package com.strata.query.error;

/**
 * A function in the query was given an argument of the wrong type.
 */
public class QueryIllegalTypeOfArgumentException extends QueryExecutionException {

    public QueryIllegalTypeOfArgumentException(String message, Integer code) {
        super(message, code);
    }
}
