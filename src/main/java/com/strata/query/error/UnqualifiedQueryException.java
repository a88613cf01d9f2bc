package com.strata.query.error;

/**
 * Raised when the project or organization a query belongs to cannot be
 * determined from its filters.
 */
public class UnqualifiedQueryException extends QueryGatewayException {

    public UnqualifiedQueryException(String message) {
        super(message);
    }
}
