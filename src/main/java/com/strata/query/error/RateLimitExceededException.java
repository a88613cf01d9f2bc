package com.strata.query.error;

/**
 * Raised when the backend rejects a query because a rate limit was hit.
 */
public class RateLimitExceededException extends QueryGatewayException {

    public RateLimitExceededException(String message) {
        super(message, 429);
    }
}
