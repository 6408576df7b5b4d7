package com.tracegate.proxy.core.exceptions;

/**
 * Thrown when a hook script cannot be installed. The previously loaded script,
 * if any, stays active.
 */
public class HookLoadException extends GatewayException {

    /** Why the script was rejected. */
    public enum Reason {
        /** The script file could not be read. */
        UNREADABLE,
        /** The script failed to compile or its top-level chunk raised an error. */
        SYNTAX_INVALID,
        /** Neither processRequest nor processResponse is defined. */
        NO_ENTRY_POINTS
    }

    private final Reason reason;

    public HookLoadException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public HookLoadException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
