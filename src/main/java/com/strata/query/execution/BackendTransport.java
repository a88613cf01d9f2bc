package com.strata.query.execution;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Sends a request to the backend and returns whatever came back. Any HTTP
 * status is a response; only transport failures are errors.
 */
public interface BackendTransport {

    Mono<BackendResponse> send(BackendRequest request, Map<String, String> headers);
}
