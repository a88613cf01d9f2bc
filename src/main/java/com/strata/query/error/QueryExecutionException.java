package com.strata.query.error;

/**
 * Exception thrown when the backend failed to execute a query.
 * Carries the backend error code when one was reported.
 */
public class QueryExecutionException extends QueryGatewayException {

    private final Integer code;

    public QueryExecutionException(String message) {
        this(message, null);
    }

    public QueryExecutionException(String message, Integer code) {
        super(message);
        this.code = code;
    }

    public Integer getCode() {
        return code;
    }

    /**
     * Whether a caller may reasonably retry the query later with backoff.
     * The gateway itself never retries.
     */
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (code != null) {
            sb.append(" [Code: ").append(code).append("]");
        }
        return sb.toString();
    }
}
