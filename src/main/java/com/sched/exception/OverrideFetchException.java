package com.sched.exception;

/**
 * Exception thrown when scheduling strategies cannot be fetched from the API server.
 * Transient: the refresh loop logs it and tries again on the next tick.
 */
public class OverrideFetchException extends PluginException {

    public OverrideFetchException(String message) {
        super(message);
    }

    public OverrideFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
