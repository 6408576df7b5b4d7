package com.tracegate.proxy.core.trace;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One completed request/response exchange as shown to trace observers.
 *
 * @param id             16 lowercase hex characters.
 * @param timestamp      When the request arrived.
 * @param method         Request method.
 * @param url            Fully-qualified upstream URL, including the query.
 * @param status         Status text such as {@code "200 OK"}.
 * @param latency        Seconds from request start until the upstream response
 *                       headers arrived.
 * @param sessionId      Upstream {@code X-Session-Id}, if any.
 * @param requestHeaders Headers sent upstream, after hooks.
 * @param requestBody    Body sent upstream, after hooks.
 * @param responseBody   Buffered response text, or a placeholder for streams.
 */
@JsonPropertyOrder({ "id", "timestamp", "method", "url", "status", "latency", "session_id", "request_headers",
        "request_body", "response_body" })
public record Trace(
        String id,
        Instant timestamp,
        String method,
        String url,
        String status,
        double latency,
        @JsonProperty("session_id") @JsonInclude(JsonInclude.Include.NON_EMPTY) String sessionId,
        @JsonProperty("request_headers") @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, List<String>> requestHeaders,
        @JsonProperty("request_body") @JsonInclude(JsonInclude.Include.NON_EMPTY) String requestBody,
        @JsonProperty("response_body") @JsonInclude(JsonInclude.Include.NON_EMPTY) String responseBody) {

    private static final SecureRandom RANDOM = new SecureRandom();

    public Trace {
        requestHeaders = requestHeaders == null ? Map.of() : Map.copyOf(requestHeaders);
    }

    /**
     * @return A fresh random trace id: 8 random bytes as lowercase hex.
     */
    public static String newId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Placeholder recorded instead of the body of a streamed response.
     */
    public static String streamingPlaceholder(long bytes) {
        return String.format("[STREAMING RESPONSE - %d bytes]", bytes);
    }
}
