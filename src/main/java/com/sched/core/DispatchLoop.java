package com.sched.core;

import com.sched.exception.SourceUnavailableException;
import com.sched.model.QueuedTask;
import com.sched.plugin.CustomScheduler;
import com.sched.plugin.TaskSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives a scheduler against a task source: drain, select, time slice, CPU.
 * <p>
 * A zero time slice from the policy falls back to {@code defaultSlice / max(1, nrQueued)}.
 * <p>
 * A task whose CPU selection fails is kept and retried on the next iteration, before anything
 * else is selected. If the retry fails as well the run ends and the task stays pending for the
 * next {@link #run(int)}. Every failed attempt is logged and counted.
 */
public class DispatchLoop {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final CustomScheduler scheduler;
    private final TaskSource source;
    private final long defaultSlice;
    private long failed;
    private QueuedTask pendingRetry;

    public DispatchLoop(CustomScheduler scheduler, TaskSource source, long defaultSlice) {
        if (defaultSlice <= 0) {
            throw new IllegalArgumentException("defaultSlice must be positive");
        }
        this.scheduler = scheduler;
        this.source = source;
        this.defaultSlice = defaultSlice;
    }

    /**
     * Run until nothing is left to dispatch or {@code maxDispatches} decisions were made.
     *
     * @return the dispatch decisions in order
     */
    public List<Dispatch> run(int maxDispatches) {
        List<Dispatch> dispatched = new ArrayList<>();
        while (dispatched.size() < maxDispatches) {
            boolean retry = pendingRetry != null;
            QueuedTask task;
            if (retry) {
                task = pendingRetry;
                pendingRetry = null;
            } else {
                scheduler.drainQueuedTask(source);
                Optional<QueuedTask> next = scheduler.selectQueuedTask(source);
                if (next.isEmpty()) {
                    break;
                }
                task = next.get();
            }
            long slice = scheduler.determineTimeSlice(source, task);
            if (slice == 0) {
                slice = defaultSlice / Math.max(1L, source.getNrQueued());
            }
            int cpu;
            try {
                cpu = scheduler.selectCpu(source, task);
            } catch (SourceUnavailableException e) {
                failed++;
                pendingRetry = task;
                log.warn("CPU selection failed for pid {}{}: {}", task.pid(), retry ? " (retry)" : "", e.getMessage());
                if (retry) {
                    break;
                }
                continue;
            }
            Dispatch dispatch = new Dispatch(task, cpu, slice);
            log.debug("Dispatch {}", dispatch);
            dispatched.add(dispatch);
        }
        return dispatched;
    }

    /**
     * Failed CPU selection attempts.
     */
    public long getFailedCount() {
        return failed;
    }

    /**
     * Task waiting for a CPU selection retry.
     */
    public Optional<QueuedTask> getPendingRetry() {
        return Optional.ofNullable(pendingRetry);
    }

    /**
     * One dispatch decision.
     */
    public record Dispatch(QueuedTask task, int cpu, long sliceNs) {

        @Override
        public String toString() {
            return "Dispatch{pid=" + task.pid() + ", cpu=" + cpu + ", sliceNs=" + sliceNs + "}";
        }
    }
}
