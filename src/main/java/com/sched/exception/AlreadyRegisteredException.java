package com.sched.exception;

/**
 * Exception thrown when a plugin mode is registered twice.
 * The first registration stays in place.
 */
public class AlreadyRegisteredException extends PluginException {

    public AlreadyRegisteredException(String message) {
        super(message);
    }

    public AlreadyRegisteredException(String message, Throwable cause) {
        super(message, cause);
    }
}
