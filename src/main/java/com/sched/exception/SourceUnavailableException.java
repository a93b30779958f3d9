package com.sched.exception;

/**
 * Exception thrown when the task source cannot pick a CPU for a task.
 * Callers log it and retry on the next loop iteration.
 */
public class SourceUnavailableException extends PluginException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
