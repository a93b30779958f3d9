package com.sched.plugin;

import com.sched.model.QueuedTask;

/**
 * Kernel-side task source: hands runnable tasks to a policy and takes CPU decisions back.
 */
public interface TaskSource {

    /**
     * Pull the next runnable task.
     * Must not block indefinitely; waiting for work is the caller's business.
     *
     * @return The next task, or {@link QueuedTask#NONE} when nothing is available
     */
    QueuedTask dequeueTask();

    /**
     * Pick a CPU for the task with the source's own default algorithm.
     *
     * @return CPU id
     * @throws RuntimeException if no CPU can be picked
     */
    int defaultSelectCpu(QueuedTask task);

    /**
     * Number of tasks still pending at the source.
     */
    long getNrQueued();
}
