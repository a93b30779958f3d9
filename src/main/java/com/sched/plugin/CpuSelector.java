package com.sched.plugin;

import com.sched.exception.SourceUnavailableException;
import com.sched.model.QueuedTask;

/**
 * CPU selection by delegation to the task source.
 */
public final class CpuSelector {

    private CpuSelector() {
    }

    /**
     * Ask the source's default picker for a CPU.
     *
     * @throws SourceUnavailableException if the source fails to pick one
     */
    public static int delegate(TaskSource source, QueuedTask task) {
        if (source == null) {
            throw new SourceUnavailableException("no task source to select a CPU for pid " + task.pid());
        }
        try {
            return source.defaultSelectCpu(task);
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("CPU selection failed for pid " + task.pid(), e);
        }
    }
}
