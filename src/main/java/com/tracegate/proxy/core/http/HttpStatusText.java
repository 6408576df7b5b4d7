package com.tracegate.proxy.core.http;

import java.util.Map;

/**
 * Standard reason phrases for status lines written by the gateway and recorded
 * in traces.
 */
public final class HttpStatusText {

    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(100, "Continue"), Map.entry(101, "Switching Protocols"),
            Map.entry(200, "OK"), Map.entry(201, "Created"),
            Map.entry(202, "Accepted"), Map.entry(204, "No Content"),
            Map.entry(206, "Partial Content"), Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"), Map.entry(303, "See Other"),
            Map.entry(304, "Not Modified"), Map.entry(307, "Temporary Redirect"),
            Map.entry(308, "Permanent Redirect"), Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"), Map.entry(403, "Forbidden"),
            Map.entry(404, "Not Found"), Map.entry(405, "Method Not Allowed"),
            Map.entry(408, "Request Timeout"), Map.entry(409, "Conflict"),
            Map.entry(413, "Payload Too Large"), Map.entry(415, "Unsupported Media Type"),
            Map.entry(422, "Unprocessable Entity"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    private HttpStatusText() {
        // Utility class
    }

    /**
     * @return The reason phrase for the code, or an empty string if unknown.
     */
    public static String reason(int status) {
        return REASON_PHRASES.getOrDefault(status, "");
    }

    /**
     * @return Status text in the form {@code "200 OK"}; just the code if the
     *         reason is unknown.
     */
    public static String statusLine(int status) {
        String reason = reason(status);
        return reason.isEmpty() ? String.valueOf(status) : status + " " + reason;
    }

    /**
     * @return True if a response with this status never carries a body.
     */
    public static boolean forbidsBody(int status) {
        return (status >= 100 && status < 200) || status == 204 || status == 304;
    }
}
