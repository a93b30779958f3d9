package com.sched.config;

import com.sched.pool.TaskPool;

/**
 * Time-slice and pool parameters handed to a policy.
 * Zero values mean "use the policy's default".
 *
 * @param sliceNsDefault Default time slice in nanoseconds
 * @param sliceNsMin     Minimum time slice in nanoseconds
 * @param poolCapacity   Task pool capacity (one slot reserved)
 */
public record SchedulerConfig(
        long sliceNsDefault,
        long sliceNsMin,
        int poolCapacity
) {
    public static final long DEFAULT_SLICE_NS = 5000L * 1000;
    public static final long DEFAULT_SLICE_NS_MIN = 500L * 1000;

    public SchedulerConfig {
        if (sliceNsDefault < 0 || sliceNsMin < 0) {
            throw new IllegalArgumentException("Slice durations cannot be negative");
        }
        if (poolCapacity <= 0) {
            poolCapacity = TaskPool.DEFAULT_CAPACITY;
        }
    }

    public SchedulerConfig(long sliceNsDefault, long sliceNsMin) {
        this(sliceNsDefault, sliceNsMin, TaskPool.DEFAULT_CAPACITY);
    }

    /**
     * All defaults left to the policy.
     */
    public static SchedulerConfig defaults() {
        return new SchedulerConfig(0, 0, TaskPool.DEFAULT_CAPACITY);
    }
}
