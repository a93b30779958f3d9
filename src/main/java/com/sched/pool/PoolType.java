package com.sched.pool;

/**
 * Available pool arrangements.
 */
public enum PoolType {
    /**
     * Arrival order only. Entries are appended, the head is selected.
     */
    FIFO,

    /**
     * Sorted list: entries inserted by linear scan on (key, timestamp, pid).
     * O(n) insertion, O(1) selection.
     */
    ORDERED_LIST,

    /**
     * Binary min-heap over a preallocated array on (key, timestamp, pid).
     * O(log n) admission and selection, for higher task churn.
     */
    MIN_HEAP
}
