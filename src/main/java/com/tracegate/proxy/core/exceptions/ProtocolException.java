package com.tracegate.proxy.core.exceptions;

/**
 * A peer broke HTTP/1.1 or WebSocket framing rules: a malformed request line,
 * an oversized header block, a bad chunk size or an unmasked client frame.
 * Listeners answer it with 400 where a response is still possible.
 */
public class ProtocolException extends GatewayException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
