package com.sched.pool;

import com.sched.core.PoolEntry;

import java.util.Optional;

/**
 * Bounded holding area for tasks that became runnable but were not selected yet.
 * <p>
 * One ordering discipline per pool, fixed at construction:
 * - {@link OrderedListTaskPool}: ordered insertion by linear scan, or plain append in FIFO mode
 * - {@link HeapTaskPool}: binary min-heap over a preallocated array
 * <p>
 * A pool of capacity {@code n} holds at most {@code n - 1} entries; the last slot is reserved.
 */
public interface TaskPool {

    /**
     * Default pool capacity.
     */
    int DEFAULT_CAPACITY = 4096;

    /**
     * Get the ordering discipline name.
     */
    String getName();

    /**
     * Admit an entry.
     *
     * @param entry The entry to admit
     * @return true if admitted, false if the pool is full
     */
    boolean offer(PoolEntry entry);

    /**
     * Remove and return the most eligible entry.
     *
     * @return The entry, or empty if the pool is empty
     */
    Optional<PoolEntry> poll();

    /**
     * Look at the most eligible entry without removing it.
     */
    Optional<PoolEntry> peek();

    /**
     * Current number of resident entries.
     */
    int size();

    /**
     * Configured capacity (one slot of which is reserved).
     */
    int getCapacity();

    /**
     * Whether no further entry can be admitted.
     */
    default boolean isFull() {
        return size() >= getCapacity() - 1;
    }

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Number of entries that can still be admitted.
     */
    default int getRemainingCapacity() {
        return Math.max(0, getCapacity() - 1 - size());
    }
}
