package com.sched.adapter.source;

import com.sched.model.QueuedTask;
import com.sched.plugin.TaskSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Deterministic task source backed by a queue.
 * <p>
 * Tasks come out in submission order. CPU selection uses the task's preferred CPU
 * unless a picker is installed. Thread-safe.
 */
public class InMemoryTaskSource implements TaskSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskSource.class);

    private final Deque<QueuedTask> queue = new ArrayDeque<>();
    private final List<QueuedTask> dequeued = new ArrayList<>();
    private volatile ToIntFunction<QueuedTask> cpuPicker = QueuedTask::cpu;

    public InMemoryTaskSource() {
    }

    public InMemoryTaskSource(Collection<QueuedTask> tasks) {
        submitAll(tasks);
    }

    public synchronized void submit(QueuedTask task) {
        queue.addLast(task);
    }

    public synchronized void submitAll(Collection<QueuedTask> tasks) {
        queue.addAll(tasks);
    }

    /**
     * Replace the CPU selection algorithm.
     */
    public void setCpuPicker(ToIntFunction<QueuedTask> cpuPicker) {
        this.cpuPicker = cpuPicker;
    }

    /**
     * Make every CPU selection fail with the given message.
     */
    public void failCpuSelection(String message) {
        this.cpuPicker = task -> {
            throw new IllegalStateException(message);
        };
    }

    @Override
    public synchronized QueuedTask dequeueTask() {
        QueuedTask task = queue.pollFirst();
        if (task == null) {
            return QueuedTask.NONE;
        }
        dequeued.add(task);
        return task;
    }

    @Override
    public int defaultSelectCpu(QueuedTask task) {
        int cpu = cpuPicker.applyAsInt(task);
        log.trace("Selected CPU {} for pid {}", cpu, task.pid());
        return cpu;
    }

    @Override
    public synchronized long getNrQueued() {
        return queue.size();
    }

    /**
     * Tasks handed out so far, in order.
     */
    public synchronized List<QueuedTask> getDequeued() {
        return List.copyOf(dequeued);
    }
}
