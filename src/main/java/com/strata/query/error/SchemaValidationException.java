package com.strata.query.error;

/**
 * The backend rejected the query as structurally invalid. Needs a client-side fix.
 */
public class SchemaValidationException extends QueryExecutionException {

    public SchemaValidationException(String message) {
        super(message);
    }
}
