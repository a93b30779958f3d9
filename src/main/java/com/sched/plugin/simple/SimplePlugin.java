package com.sched.plugin.simple;

import com.sched.core.PoolEntry;
import com.sched.core.VirtualTime;
import com.sched.model.QueuedTask;
import com.sched.plugin.CpuSelector;
import com.sched.plugin.CustomScheduler;
import com.sched.plugin.TaskSource;
import com.sched.pool.PoolType;
import com.sched.pool.TaskPool;
import com.sched.pool.TaskPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Basic scheduler with two modes.
 * <p>
 * Weighted vtime (default):
 * - Admission key is the task's vtime, clamped to {@code clock - sliceDefault} so an idle task
 *   cannot bank more than one slice of credit
 * - Selection advances the global clock to the selected key
 * - {@link #chargeStoppedTask(QueuedTask, long)} charges runtime scaled by the inverse weight
 * <p>
 * FIFO:
 * - Admission key is the arrival order, the clock is never touched
 * <p>
 * Keys and the clock are never zero.
 */
public class SimplePlugin implements CustomScheduler {

    private static final Logger log = LoggerFactory.getLogger(SimplePlugin.class);

    /**
     * 0.5ms in nanoseconds.
     */
    public static final long DEFAULT_SLICE_NS = 5000L * 100;

    private final boolean fifoMode;
    private volatile long sliceDefault;

    private final TaskPool taskPool;

    // Global vtime, starts at 1 so it is never 0
    private final AtomicLong vtimeNow = new AtomicLong(VirtualTime.MIN_KEY);

    // FIFO arrival sequence
    private long arrivalSeq;

    private final AtomicLong admittedCount = new AtomicLong(0);
    private final AtomicLong selectedCount = new AtomicLong(0);
    private final AtomicLong discardedCount = new AtomicLong(0);

    public SimplePlugin(boolean fifoMode) {
        this(fifoMode, TaskPool.DEFAULT_CAPACITY);
    }

    public SimplePlugin(boolean fifoMode, int poolCapacity) {
        this.fifoMode = fifoMode;
        this.sliceDefault = DEFAULT_SLICE_NS;
        this.taskPool = TaskPoolFactory.create(fifoMode ? PoolType.FIFO : PoolType.ORDERED_LIST, poolCapacity);
        log.info("SimplePlugin initialized: mode={}, capacity={}",
                fifoMode ? "fifo" : "weighted-vtime", taskPool.getCapacity());
    }

    public void setSliceDefault(long slice) {
        if (slice > 0) {
            this.sliceDefault = slice;
        }
    }

    public long getSliceDefault() {
        return sliceDefault;
    }

    public boolean isFifoMode() {
        return fifoMode;
    }

    @Override
    public int drainQueuedTask(TaskSource source) {
        int count = 0;

        // Keep draining until the pool is full or no more tasks are available
        while (!taskPool.isFull()) {
            QueuedTask queuedTask = source.dequeueTask();
            if (queuedTask == null || queuedTask.isSentinel()) {
                break;
            }
            if (!queuedTask.isValid()) {
                discardedCount.incrementAndGet();
                log.trace("Discarding invalid task with pid {}", queuedTask.pid());
                continue;
            }

            PoolEntry entry = enqueueTask(queuedTask);
            if (!taskPool.offer(entry)) {
                break;
            }
            count++;
        }

        if (count > 0) {
            admittedCount.addAndGet(count);
            log.trace("Drained {} tasks, pool size: {}", count, taskPool.size());
        }
        return count;
    }

    @Override
    public Optional<QueuedTask> selectQueuedTask(TaskSource source) {
        Optional<PoolEntry> next = taskPool.poll();
        if (next.isEmpty()) {
            return Optional.empty();
        }
        PoolEntry entry = next.get();
        if (!fifoMode) {
            updateRunningTask(entry.getKey());
        }
        selectedCount.incrementAndGet();
        return Optional.of(entry.getTask());
    }

    @Override
    public int selectCpu(TaskSource source, QueuedTask task) {
        return CpuSelector.delegate(source, task);
    }

    @Override
    public long determineTimeSlice(TaskSource source, QueuedTask task) {
        return sliceDefault;
    }

    @Override
    public int getPoolCount() {
        return taskPool.size();
    }

    /**
     * Charge the runtime a task consumed after it stopped running.
     * No-op in FIFO mode.
     *
     * @param task     The task that stopped
     * @param execTime Nanoseconds it ran
     * @return The task with its charged vtime
     */
    public QueuedTask chargeStoppedTask(QueuedTask task, long execTime) {
        if (fifoMode) {
            return task;
        }
        long charge = VirtualTime.scale(Math.max(execTime, 0L), 100, task.effectiveWeight());
        long vtime = VirtualTime.nonZero(VirtualTime.saturatingAdd(Math.max(task.vtime(), 0L), charge));
        return task.withVtime(Math.max(vtime, task.vtime()));
    }

    /**
     * Current global vtime.
     */
    public long getVtimeNow() {
        return vtimeNow.get();
    }

    public Stats getStats() {
        return new Stats(admittedCount.get(), selectedCount.get(), discardedCount.get());
    }

    public void resetStats() {
        admittedCount.set(0);
        selectedCount.set(0);
        discardedCount.set(0);
    }

    public TaskPool getTaskPool() {
        return taskPool;
    }

    private PoolEntry enqueueTask(QueuedTask task) {
        if (fifoMode) {
            return new PoolEntry(task, ++arrivalSeq, task.startTs());
        }

        long vtime = Math.max(task.vtime(), 0L);
        // Limit the budget an idling task can accumulate to one slice
        long floor = VirtualTime.saturatingSub(vtimeNow.get(), sliceDefault);
        if (vtime < floor) {
            vtime = floor;
        }
        return new PoolEntry(task, VirtualTime.nonZero(vtime), task.startTs());
    }

    private void updateRunningTask(long key) {
        // Global vtime always progresses forward as tasks start executing
        vtimeNow.accumulateAndGet(VirtualTime.nonZero(key), VirtualTime::advance);
    }

    /**
     * Scheduling counters.
     *
     * @param admitted  Tasks admitted into the pool
     * @param selected  Tasks handed back for dispatch
     * @param discarded Invalid tasks dropped during drain
     */
    public record Stats(long admitted, long selected, long discarded) {
    }
}
