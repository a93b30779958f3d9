package com.sched.plugin.gthulhu;

import com.sched.exception.OverrideFetchException;
import com.sched.plugin.PluginContext;
import com.sched.plugin.SchedulingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background refresh of the strategy snapshot.
 * <p>
 * Fetches immediately on start, then once per interval. A failed fetch is logged and
 * leaves the current snapshot in place; the next tick retries. Stopping (directly or by
 * cancelling the owning {@link PluginContext}) shuts down the timer thread and no further
 * fetch starts.
 */
public class StrategyFetcher {

    private static final Logger log = LoggerFactory.getLogger(StrategyFetcher.class);

    private final StrategyClient client;
    private final StrategyStore store;
    private final Duration interval;
    private final ScheduledExecutorService timer;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final AtomicLong successCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);

    public StrategyFetcher(StrategyClient client, StrategyStore store, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Refresh interval must be positive");
        }
        this.client = client;
        this.store = store;
        this.interval = interval;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "strategy-fetcher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start refreshing and stop when the context is cancelled.
     */
    public void start(PluginContext context) {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        context.onCancel(this::stop);
        // Guarded together with stop(): a shut down timer is never scheduled on
        synchronized (lifecycleLock) {
            if (stopped.get()) {
                return;
            }
            timer.scheduleWithFixedDelay(this::refresh, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Strategy fetcher started, interval: {}", interval);
    }

    /**
     * Run one fetch and, on success, replace the snapshot.
     */
    void refresh() {
        if (stopped.get()) {
            return;
        }
        try {
            List<SchedulingStrategy> strategies = client.fetchStrategies();
            if (strategies == null) {
                log.debug("Strategy fetch returned no data, keeping current snapshot");
                return;
            }
            if (stopped.get()) {
                return;
            }
            store.replace(strategies);
            successCount.incrementAndGet();
            log.debug("Scheduling strategies updated: {} strategies", strategies.size());
        } catch (OverrideFetchException e) {
            failureCount.incrementAndGet();
            log.warn("Failed to fetch scheduling strategies: {}", e.getMessage());
        } catch (RuntimeException e) {
            failureCount.incrementAndGet();
            log.warn("Unexpected error while fetching scheduling strategies", e);
        }
    }

    /**
     * Stop refreshing. Idempotent.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            timer.shutdownNow();
        }
        log.info("Strategy fetcher stopped after {} successful and {} failed fetches",
                successCount.get(), failureCount.get());
    }

    /**
     * Wait for the timer thread to finish after {@link #stop()}.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return timer.awaitTermination(timeout, unit);
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }
}
