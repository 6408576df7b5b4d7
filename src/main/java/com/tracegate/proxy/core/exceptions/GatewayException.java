package com.tracegate.proxy.core.exceptions;

/**
 * Base exception for failures of the gateway itself, as opposed to failures of
 * a single request, which are answered with an error response instead.
 */
public class GatewayException extends RuntimeException {
    /**
     * @param message the detail message.
     */
    public GatewayException(String message) {
        super(message);
    }

    /**
     * @param message the detail message.
     * @param cause   the underlying failure.
     */
    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
