package com.sched.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating TaskPool instances.
 */
public class TaskPoolFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskPoolFactory.class);

    private TaskPoolFactory() {
    }

    /**
     * Create a TaskPool of the given arrangement.
     *
     * @param type     Pool arrangement, null defaults to ORDERED_LIST
     * @param capacity Pool capacity, values below 2 default to {@link TaskPool#DEFAULT_CAPACITY}
     * @return TaskPool instance
     */
    public static TaskPool create(PoolType type, int capacity) {
        if (type == null) {
            type = PoolType.ORDERED_LIST;
        }
        if (capacity < 2) {
            log.debug("Invalid pool capacity {}, using default {}", capacity, TaskPool.DEFAULT_CAPACITY);
            capacity = TaskPool.DEFAULT_CAPACITY;
        }

        log.debug("Creating TaskPool: {} (capacity={})", type, capacity);

        return switch (type) {
            case FIFO -> new OrderedListTaskPool(capacity, true);
            case ORDERED_LIST -> new OrderedListTaskPool(capacity, false);
            case MIN_HEAP -> new HeapTaskPool(capacity);
        };
    }

    /**
     * Create a pool with the default capacity.
     */
    public static TaskPool createDefault(PoolType type) {
        return create(type, TaskPool.DEFAULT_CAPACITY);
    }
}
