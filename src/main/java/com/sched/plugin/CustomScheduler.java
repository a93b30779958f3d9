package com.sched.plugin;

import com.sched.model.QueuedTask;

import java.util.Optional;

/**
 * Uniform contract every scheduling policy implements, so the dispatch loop
 * does not need to know which policy is active.
 * <p>
 * Drain/select/CPU/time-slice calls come from a single dispatch loop per instance.
 * {@link #getPoolCount()} may be read from any thread.
 */
public interface CustomScheduler extends AutoCloseable {

    /**
     * Pull runnable tasks from the source into the pool.
     *
     * @param source Task source
     * @return Number of tasks admitted
     */
    int drainQueuedTask(TaskSource source);

    /**
     * Remove the most eligible task from the pool.
     *
     * @param source Task source
     * @return The selected task, or empty if the pool is empty
     */
    Optional<QueuedTask> selectQueuedTask(TaskSource source);

    /**
     * Pick the CPU the task is dispatched to.
     *
     * @return CPU id
     * @throws com.sched.exception.SourceUnavailableException if the source cannot pick one
     */
    int selectCpu(TaskSource source, QueuedTask task);

    /**
     * Time slice for the task, in nanoseconds.
     * 0 means "no opinion", the caller applies its own default.
     */
    long determineTimeSlice(TaskSource source, QueuedTask task);

    /**
     * Number of tasks waiting in the pool.
     */
    int getPoolCount();

    /**
     * Push an opaque metrics payload. Policies without metrics support ignore it.
     */
    default void sendMetrics(Object data) {
    }

    /**
     * Strategy overrides added/removed since the previous call.
     */
    default StrategyChanges getChangedStrategies() {
        return StrategyChanges.none();
    }

    /**
     * Stop background work owned by the policy.
     */
    @Override
    default void close() {
    }
}
