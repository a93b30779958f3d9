package com.sched.pool;

import com.sched.core.PoolEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Binary min-heap pool over a fixed, preallocated array.
 * <p>
 * - offer: place at the end, sift up
 * - poll: take the root, move the last entry to the root, sift down
 * - Both O(log n)
 */
public class HeapTaskPool implements TaskPool {

    private static final Logger log = LoggerFactory.getLogger(HeapTaskPool.class);

    private final int capacity;
    private final PoolEntry[] heap;
    private int count;
    private final ReentrantLock lock = new ReentrantLock();

    public HeapTaskPool(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Pool capacity must be at least 2, got " + capacity);
        }
        this.capacity = capacity;
        this.heap = new PoolEntry[capacity];
        this.count = 0;
        log.debug("HeapTaskPool initialized with capacity: {}", capacity);
    }

    @Override
    public String getName() {
        return "MIN_HEAP";
    }

    @Override
    public boolean offer(PoolEntry entry) {
        lock.lock();
        try {
            if (count >= capacity - 1) {
                log.trace("Heap at capacity ({}), rejecting pid {}", capacity, entry.getPid());
                return false;
            }
            heap[count] = entry;
            siftUp(count);
            count++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PoolEntry> poll() {
        lock.lock();
        try {
            if (count == 0) {
                return Optional.empty();
            }
            PoolEntry top = heap[0];
            count--;
            if (count > 0) {
                heap[0] = heap[count];
                siftDown(0);
            }
            heap[count] = null;
            return Optional.of(top);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PoolEntry> peek() {
        lock.lock();
        try {
            return count == 0 ? Optional.empty() : Optional.of(heap[0]);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    private boolean less(int i, int j) {
        return heap[i].isBefore(heap[j]);
    }

    private void swap(int i, int j) {
        PoolEntry tmp = heap[i];
        heap[i] = heap[j];
        heap[j] = tmp;
    }

    private void siftUp(int idx) {
        while (idx > 0) {
            int parent = (idx - 1) / 2;
            if (!less(idx, parent)) {
                break;
            }
            swap(idx, parent);
            idx = parent;
        }
    }

    private void siftDown(int idx) {
        while (true) {
            int left = 2 * idx + 1;
            if (left >= count) {
                break;
            }
            int smallest = left;
            int right = left + 1;
            if (right < count && less(right, left)) {
                smallest = right;
            }
            if (!less(smallest, idx)) {
                break;
            }
            swap(idx, smallest);
            idx = smallest;
        }
    }
}
