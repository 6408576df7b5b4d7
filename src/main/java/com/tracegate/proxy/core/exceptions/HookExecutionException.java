package com.tracegate.proxy.core.exceptions;

/**
 * Thrown when a hook script fails while running inside its sandbox, including
 * malformed return values and exceeded instruction budgets.
 */
public class HookExecutionException extends GatewayException {
    public HookExecutionException(String message) {
        super(message);
    }

    public HookExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
