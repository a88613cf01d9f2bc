package com.strata.query.error;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.function.BiFunction;

/**
 * Maps failed backend responses to the typed exception hierarchy.
 *
 * Classification is pure: the caller decides whether to throw the returned
 * exception. Nothing here retries.
 */
public final class ErrorClassifier {

    private static final int TOO_MANY_REQUESTS = 429;

    private static final Map<Integer, BiFunction<String, Integer, QueryExecutionException>> CLICKHOUSE_CODES = Map.of(
        10, QueryMissingColumnException::new,
        43, QueryIllegalTypeOfArgumentException::new,
        47, QueryMissingColumnException::new,
        62, QuerySizeExceededException::new,
        160, QueryExecutionTimeMaximumException::new,
        202, QueryTooManySimultaneousException::new,
        241, QueryMemoryLimitExceededException::new,
        271, DatasetSelectionException::new,
        279, QueryConnectionFailedException::new);

    private ErrorClassifier() {
    }

    /**
     * Classify a non-200 response whose body parsed as JSON.
     *
     * @param status HTTP status of the response
     * @param body   parsed response body, may be null
     * @return the exception describing the failure
     */
    public static QueryGatewayException classify(int status, JsonNode body) {
        JsonNode error = body != null ? body.get("error") : null;
        if (error == null || error.isNull() || (error.isObject() && error.size() == 0)) {
            return new QueryGatewayException("HTTP " + status, status);
        }

        String message = error.path("message").asText("");
        if (status == TOO_MANY_REQUESTS) {
            return new RateLimitExceededException(message);
        }

        String type = error.path("type").asText("");
        switch (type) {
            case "schema":
                return new SchemaValidationException(message);
            case "clickhouse":
                return classifyClickHouse(error, message);
            default:
                return new QueryGatewayException(message, status);
        }
    }

    /**
     * Classify a response whose body could not be parsed. A failed status
     * means the error body itself was mangled; a successful status means the
     * backend broke protocol.
     */
    public static QueryGatewayException classifyUnparseable(int status, String rawBody) {
        if (status != 200) {
            return new QueryGatewayException("Failed to parse backend error response", status);
        }
        return new UnexpectedResponseException("Could not decode JSON response: " + rawBody, status);
    }

    static QueryExecutionException classifyClickHouse(JsonNode error, String message) {
        JsonNode codeNode = error.get("code");
        if (codeNode == null || !codeNode.canConvertToInt()) {
            return new QueryExecutionException(message);
        }
        int code = codeNode.asInt();
        BiFunction<String, Integer, QueryExecutionException> factory = CLICKHOUSE_CODES.get(code);
        return factory != null ? factory.apply(message, code) : new QueryExecutionException(message, code);
    }
}
