package com.sched.exception;

/**
 * Exception thrown when a registry call receives an empty mode, a null factory
 * or a null configuration.
 */
public class InvalidArgumentException extends PluginException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
