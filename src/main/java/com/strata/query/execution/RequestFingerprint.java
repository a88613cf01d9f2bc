package com.strata.query.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.strata.query.error.QueryGatewayException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache key of a request: {@code sqc:} followed by the SHA-1 of its body
 * serialized with sorted keys, so equal requests share a key regardless of
 * map ordering.
 */
public class RequestFingerprint {

    static final String PREFIX = "sqc:";

    private final ObjectMapper canonicalMapper;

    public RequestFingerprint(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String of(BackendRequest request) {
        try {
            String canonical = request.getPath() + "\n" + canonicalMapper.writeValueAsString(request.toBody());
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return PREFIX + HexFormat.of().formatHex(sha1.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException e) {
            throw new QueryGatewayException("Request cannot be serialized: " + request, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
