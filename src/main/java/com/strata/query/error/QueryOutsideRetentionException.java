package com.strata.query.error;

/**
 * Raised when the requested time window lies entirely outside the
 * organization's retention period. The message is safe to show to users.
 */
public class QueryOutsideRetentionException extends RuntimeException {

    public QueryOutsideRetentionException(String message) {
        super(message);
    }
}
