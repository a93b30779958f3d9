package com.sched.exception;

/**
 * Exception thrown when metrics cannot be pushed to the API server.
 */
public class MetricsPushException extends PluginException {

    public MetricsPushException(String message) {
        super(message);
    }

    public MetricsPushException(String message, Throwable cause) {
        super(message, cause);
    }
}
