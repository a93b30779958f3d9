package com.sched.pool;

import com.sched.core.PoolEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered list pool.
 * <p>
 * - Priority mode: new entries are inserted in order by linear scan (key, timestamp, pid)
 * - FIFO mode: new entries are always appended
 * - The head of the list is always the next entry to select
 * <p>
 * Insertion is O(n) in the worst case, which is fine for the intended pool sizes.
 */
public class OrderedListTaskPool implements TaskPool {

    private static final Logger log = LoggerFactory.getLogger(OrderedListTaskPool.class);

    private final int capacity;
    private final boolean fifo;
    private final List<PoolEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();

    public OrderedListTaskPool(int capacity, boolean fifo) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Pool capacity must be at least 2, got " + capacity);
        }
        this.capacity = capacity;
        this.fifo = fifo;
        this.entries = new ArrayList<>();
        log.debug("OrderedListTaskPool initialized with capacity: {}, fifo: {}", capacity, fifo);
    }

    @Override
    public String getName() {
        return fifo ? "FIFO" : "ORDERED";
    }

    @Override
    public boolean offer(PoolEntry entry) {
        lock.lock();
        try {
            if (entries.size() >= capacity - 1) {
                log.trace("Pool at capacity ({}), rejecting pid {}", capacity, entry.getPid());
                return false;
            }
            if (fifo) {
                entries.add(entry);
                return true;
            }

            int insertIdx = entries.size();
            for (int i = 0; i < entries.size(); i++) {
                if (entry.isBefore(entries.get(i))) {
                    insertIdx = i;
                    break;
                }
            }
            entries.add(insertIdx, entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PoolEntry> poll() {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(entries.remove(0));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PoolEntry> peek() {
        lock.lock();
        try {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    public boolean isFifo() {
        return fifo;
    }
}
