package com.strata.query.error;

/**
 * The query needed several datasets in a combination the backend cannot serve.
 */
public class DatasetSelectionException extends QueryExecutionException {

    public DatasetSelectionException(String message, Integer code) {
        super(message, code);
    }
}
