package com.sched.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation scope handed to plugin factories.
 * Background work started by a plugin registers a callback and stops when the scope is cancelled.
 */
public final class PluginContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginContext.class);

    private final String name;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new ArrayList<>();

    public PluginContext(String name) {
        this.name = name;
    }

    /**
     * A fresh, uncancelled context.
     */
    public static PluginContext background() {
        return new PluginContext("background");
    }

    public String getName() {
        return name;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Register a callback run on cancellation.
     * Runs immediately if the context is already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (!cancelled.get()) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    /**
     * Cancel the context and run the registered callbacks once, in registration order.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        log.debug("Context '{}' cancelled, running {} callbacks", name, toRun.size());
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed in context '{}'", name, e);
            }
        }
    }

    @Override
    public void close() {
        cancel();
    }
}
