package com.sched.plugin.gthulhu;

import com.sched.plugin.SchedulingStrategy;
import com.sched.plugin.StrategyChanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Replaceable snapshot of per-task strategy overrides, keyed by target id.
 * <p>
 * The active map is never mutated: {@link #replace(Collection)} builds a new map outside the lock
 * and swaps it in under the write lock, so readers see either the old or the new snapshot.
 * Each swap also records what was added and removed, reported by {@link #drainChanges()}.
 */
public class StrategyStore {

    private static final Logger log = LoggerFactory.getLogger(StrategyStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<Integer, SchedulingStrategy> strategies = Map.of();

    // Guarded by the write lock
    private final List<SchedulingStrategy> pendingAdded = new ArrayList<>();
    private final List<SchedulingStrategy> pendingRemoved = new ArrayList<>();

    /**
     * Strategy for the given id, if any.
     */
    public Optional<SchedulingStrategy> lookup(int id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(strategies.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the whole snapshot. Later entries win for duplicate ids.
     */
    public void replace(Collection<SchedulingStrategy> incoming) {
        Map<Integer, SchedulingStrategy> newMap = new HashMap<>();
        if (incoming != null) {
            for (SchedulingStrategy strategy : incoming) {
                if (strategy != null) {
                    newMap.put(strategy.pid(), strategy);
                }
            }
        }
        Map<Integer, SchedulingStrategy> frozen = Map.copyOf(newMap);

        lock.writeLock().lock();
        try {
            Map<Integer, SchedulingStrategy> old = strategies;
            strategies = frozen;
            recordChanges(old, frozen);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Updated strategy map with {} strategies", frozen.size());
    }

    /**
     * Changes accumulated since the previous call.
     */
    public StrategyChanges drainChanges() {
        lock.writeLock().lock();
        try {
            if (pendingAdded.isEmpty() && pendingRemoved.isEmpty()) {
                return StrategyChanges.none();
            }
            StrategyChanges changes = new StrategyChanges(pendingAdded, pendingRemoved);
            pendingAdded.clear();
            pendingRemoved.clear();
            return changes;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The current snapshot (immutable).
     */
    public Map<Integer, SchedulingStrategy> snapshot() {
        lock.readLock().lock();
        try {
            return strategies;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return snapshot().size();
    }

    private void recordChanges(Map<Integer, SchedulingStrategy> old, Map<Integer, SchedulingStrategy> fresh) {
        for (Map.Entry<Integer, SchedulingStrategy> entry : fresh.entrySet()) {
            SchedulingStrategy previous = old.get(entry.getKey());
            if (previous == null) {
                pendingAdded.add(entry.getValue());
            } else if (!previous.equals(entry.getValue())) {
                pendingRemoved.add(previous);
                pendingAdded.add(entry.getValue());
            }
        }
        for (Map.Entry<Integer, SchedulingStrategy> entry : old.entrySet()) {
            if (!fresh.containsKey(entry.getKey())) {
                pendingRemoved.add(entry.getValue());
            }
        }
    }
}
