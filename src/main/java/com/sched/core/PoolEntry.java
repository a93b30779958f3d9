package com.sched.core;

import com.sched.model.QueuedTask;

import java.util.Objects;

/**
 * Task wrapper with the priority metadata used while the task sits in a pool.
 * <p>
 * Comparison order:
 * 1. Priority key (vtime or deadline, lower = more eligible)
 * 2. Timestamp (older task wins)
 * 3. Pid (lower pid wins)
 */
public final class PoolEntry implements Comparable<PoolEntry> {

    private final QueuedTask task;
    private final long key;
    private final long timestamp;

    public PoolEntry(QueuedTask task, long key, long timestamp) {
        this.task = Objects.requireNonNull(task, "task cannot be null");
        this.key = key;
        this.timestamp = timestamp;
    }

    public QueuedTask getTask() {
        return task;
    }

    public long getKey() {
        return key;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getPid() {
        return task.pid();
    }

    @Override
    public int compareTo(PoolEntry other) {
        int keyCmp = Long.compare(this.key, other.key);
        if (keyCmp != 0) {
            return keyCmp;
        }

        int tsCmp = Long.compare(this.timestamp, other.timestamp);
        if (tsCmp != 0) {
            return tsCmp;
        }

        return Integer.compare(this.task.pid(), other.task.pid());
    }

    /**
     * Strict "more eligible than" test.
     */
    public boolean isBefore(PoolEntry other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return "PoolEntry{" +
                "pid=" + task.pid() +
                ", key=" + key +
                ", timestamp=" + timestamp +
                '}';
    }
}
