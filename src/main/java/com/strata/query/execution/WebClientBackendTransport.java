package com.strata.query.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.query.QueryMetrics;
import com.strata.query.error.QueryGatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;

/**
 * {@link BackendTransport} over HTTP.
 *
 * Features:
 * - Connect and response timeouts from the configured client
 * - Retry with exponential backoff on connection failures, as decided by {@link RetryPolicy}
 * - Every retry counted per method and path
 * - Final transport failures surface as {@link QueryGatewayException}
 */
@Component
public class WebClientBackendTransport implements BackendTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientBackendTransport.class);

    private static final String METHOD = "POST";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final QueryMetrics metrics;
    private final int maxRetries;
    private final Duration retryBackoff;

    public WebClientBackendTransport(
            @Qualifier("backendWebClient") WebClient webClient,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy,
            QueryMetrics metrics,
            @Value("${strata.gateway.max-retries:5}") int maxRetries,
            @Value("${strata.gateway.retry-backoff-ms:100}") long retryBackoffMs) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
        this.retryBackoff = Duration.ofMillis(retryBackoffMs);
    }

    @Override
    public Mono<BackendResponse> send(BackendRequest request, Map<String, String> headers) {
        String path = request.getPath();
        String body;
        try {
            body = objectMapper.writeValueAsString(request.toBody());
        } catch (JsonProcessingException e) {
            return Mono.error(new QueryGatewayException("Request cannot be serialized: " + request, e));
        }

        return webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .headers(h -> headers.forEach(h::set))
            .bodyValue(body)
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(content -> new BackendResponse(response.rawStatusCode(), content)))
            .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                .filter(retryPolicy::shouldRetry)
                .doBeforeRetry(signal -> {
                    metrics.recordClientRetry(METHOD, path);
                    log.debug("Retrying {} {} after: {}", METHOD, path, signal.failure().toString());
                }))
            .onErrorMap(e -> !(e instanceof QueryGatewayException), e -> {
                Throwable cause = Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : e;
                log.warn("Backend request {} {} failed: {}", METHOD, path, cause.toString());
                return new QueryGatewayException(cause.toString(), cause);
            });
    }
}
