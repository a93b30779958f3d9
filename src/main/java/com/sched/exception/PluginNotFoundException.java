package com.sched.exception;

/**
 * Exception thrown when no factory is registered for the requested mode.
 */
public class PluginNotFoundException extends PluginException {

    public PluginNotFoundException(String message) {
        super(message);
    }

    public PluginNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
