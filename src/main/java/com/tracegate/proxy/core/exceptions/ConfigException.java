package com.tracegate.proxy.core.exceptions;

/**
 * Raised while loading or validating the YAML configuration. The command line
 * entry point reports it and exits with status 1 before any listener binds.
 */
public class ConfigException extends GatewayException {

    public ConfigException(String message) {
        super(message);
    }

    /**
     * @param message Which setting is wrong and why.
     * @param cause   Parser or I/O failure behind it.
     */
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
