package com.strata.query.error;

/**
 * Raised when narrowing the window to the activity of a single issue leaves
 * an empty window, meaning the query could not return any rows.
 */
public class QueryOutsideGroupActivityException extends RuntimeException {

    public QueryOutsideGroupActivityException(String message) {
        super(message);
    }
}
