package com.strata.query.execution;

/**
 * Raw backend response: HTTP status and undecoded body.
 */
public final class BackendResponse {

    private final int status;
    private final String body;

    public BackendResponse(int status, String body) {
        this.status = status;
        this.body = body != null ? body : "";
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "BackendResponse{status=" + status + ", length=" + body.length() + "}";
    }
}
