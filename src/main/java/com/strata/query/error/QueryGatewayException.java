package com.strata.query.error;

/**
 * Base exception for failures raised by the query gateway or reported by the
 * analytical backend.
 *
 * Subclasses identify the failure kind so callers can react to the type
 * instead of parsing messages.
 */
public class QueryGatewayException extends RuntimeException {

    private final Integer status;

    public QueryGatewayException(String message) {
        super(message);
        this.status = null;
    }

    public QueryGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public QueryGatewayException(String message, Integer status) {
        super(message);
        this.status = status;
    }

    /**
     * HTTP status of the backend response, when the failure came from one.
     */
    public Integer getStatus() {
        return status;
    }
}
