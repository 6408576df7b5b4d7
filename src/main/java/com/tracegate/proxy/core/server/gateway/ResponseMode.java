package com.tracegate.proxy.core.server.gateway;

import java.util.Locale;

/**
 * How an upstream response body is delivered to the client.
 */
public enum ResponseMode {
    /** Copied to the client as it arrives; no decoding, no hooks. */
    STREAM,
    /** Read completely, decoded and passed through the response hook. */
    BUFFER;

    /**
     * Classifies a response by its Content-Type. Event streams and plain text
     * are streamed; everything else, including a missing type, is buffered.
     * 
     * @param contentType Content-Type header value; may be null.
     * @return The delivery mode.
     */
    public static ResponseMode classify(String contentType) {
        if (contentType == null) {
            return BUFFER;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        if (type.contains("text/event-stream") || type.contains("text/plain")) {
            return STREAM;
        }
        return BUFFER;
    }
}
