package com.sched.model;

/**
 * Runnable task handed over by the kernel-side task source.
 * <p>
 * Immutable: policies never modify a task in place, they return an updated copy
 * (see {@link #withVtime(long)}). All time values are nanoseconds and treated as non-negative.
 *
 * @param pid            Process id; {@code -1} marks "no task available", {@code <= 0} is invalid
 * @param cpu            CPU the task last ran on
 * @param nrCpusAllowed  Cardinality of the task's CPU-affinity mask
 * @param flags          Enqueue flags
 * @param startTs        Timestamp of the last time the task was scheduled
 * @param stopTs         Timestamp of the last time the task released a CPU
 * @param sumExecRuntime Cumulative consumed CPU time
 * @param weight         Static weight (fairness divisor)
 * @param vtime          Current virtual time / priority key
 * @param tgid           Thread-group id
 */
public record QueuedTask(
        int pid,
        int cpu,
        long nrCpusAllowed,
        long flags,
        long startTs,
        long stopTs,
        long sumExecRuntime,
        long weight,
        long vtime,
        int tgid
) {

    /**
     * Pid reported by the source when it has nothing to hand out.
     */
    public static final int SENTINEL_PID = -1;

    /**
     * The "no task available" marker.
     */
    public static final QueuedTask NONE = new QueuedTask(SENTINEL_PID, -1, 0, 0, 0, 0, 0, 0, 0, SENTINEL_PID);

    public boolean isSentinel() {
        return pid == SENTINEL_PID;
    }

    public boolean isValid() {
        return pid > 0;
    }

    /**
     * Weight used as a divisor. A zero or negative weight counts as 1.
     */
    public long effectiveWeight() {
        return Math.max(weight, 1L);
    }

    public QueuedTask withVtime(long newVtime) {
        return new QueuedTask(pid, cpu, nrCpusAllowed, flags, startTs, stopTs,
                sumExecRuntime, weight, newVtime, tgid);
    }

    /**
     * Convenience factory for a task with the fields the policies look at.
     */
    public static QueuedTask of(int pid, long weight, long vtime, int tgid) {
        return new QueuedTask(pid, 0, 1, 0, 0, 0, 0, weight, vtime, tgid);
    }

    @Override
    public String toString() {
        return "QueuedTask{" +
                "pid=" + pid +
                ", tgid=" + tgid +
                ", cpu=" + cpu +
                ", weight=" + weight +
                ", vtime=" + vtime +
                '}';
    }
}
