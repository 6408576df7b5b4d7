package com.tracegate.proxy.core.exceptions;

/**
 * Thrown when a JSON document is well-formed but does not have the shape a typed
 * decoder expects.
 */
public class JsonDecodeException extends GatewayException {
    public JsonDecodeException(String message) {
        super(message);
    }
}
