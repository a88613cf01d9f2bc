package com.strata.query.error;

/**
 * Raised when the backend answers successfully with a body that is not JSON.
 */
public class UnexpectedResponseException extends QueryGatewayException {

    public UnexpectedResponseException(String message, Integer status) {
        super(message, status);
    }
}
