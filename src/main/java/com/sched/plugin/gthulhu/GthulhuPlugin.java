package com.sched.plugin.gthulhu;

import com.sched.config.SchedulerConfig;
import com.sched.core.PoolEntry;
import com.sched.core.VirtualTime;
import com.sched.exception.MetricsPushException;
import com.sched.model.QueuedTask;
import com.sched.plugin.CpuSelector;
import com.sched.plugin.CustomScheduler;
import com.sched.plugin.SchedulingStrategy;
import com.sched.plugin.StrategyChanges;
import com.sched.plugin.TaskSource;
import com.sched.pool.PoolType;
import com.sched.pool.TaskPool;
import com.sched.pool.TaskPoolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deadline scheduler backed by a min-heap, with externally supplied strategy overrides.
 * <p>
 * Admission:
 * - Override for the task's thread group with priority set: deadline 0 (most eligible)
 * - Override without priority: the task's vtime as reported
 * - No override: clamped weighted vtime plus the runtime the source already observed,
 *   and the global clock advances to the task's vtime
 * Any admission lifts the clock to at least 1.
 * <p>
 * Selection pops the heap root and leaves the clock alone.
 * The time slice comes from the override for the task's pid, 0 when there is none.
 */
public class GthulhuPlugin implements CustomScheduler {

    private static final Logger log = LoggerFactory.getLogger(GthulhuPlugin.class);

    private volatile long sliceNsDefault = SchedulerConfig.DEFAULT_SLICE_NS;
    private volatile long sliceNsMin = SchedulerConfig.DEFAULT_SLICE_NS_MIN;

    private final TaskPool taskPool;

    // Global vruntime, 0 until the first task is admitted and at least 1 afterwards
    private final AtomicLong minVruntime = new AtomicLong(0);

    private final StrategyStore strategyStore;

    private volatile MetricsClient metricsClient;
    private volatile StrategyFetcher strategyFetcher;

    public GthulhuPlugin(long sliceNsDefault, long sliceNsMin) {
        this(sliceNsDefault, sliceNsMin, TaskPool.DEFAULT_CAPACITY);
    }

    public GthulhuPlugin(long sliceNsDefault, long sliceNsMin, int poolCapacity) {
        setSchedulerConfig(sliceNsDefault, sliceNsMin);
        this.taskPool = TaskPoolFactory.create(PoolType.MIN_HEAP, poolCapacity);
        this.strategyStore = new StrategyStore();
        log.info("GthulhuPlugin initialized: sliceNsDefault={}, sliceNsMin={}, capacity={}",
                this.sliceNsDefault, this.sliceNsMin, taskPool.getCapacity());
    }

    @Override
    public int drainQueuedTask(TaskSource source) {
        int count = 0;
        // Drain until the pool is near capacity (one slot stays reserved)
        while (!taskPool.isFull()) {
            QueuedTask task = source.dequeueTask();
            if (task == null || !task.isValid()) {
                break;
            }
            PoolEntry entry = new PoolEntry(task, computeDeadline(task), task.startTs());
            if (!taskPool.offer(entry)) {
                break;
            }
            count++;
        }
        if (count > 0) {
            log.trace("Drained {} tasks, pool size: {}", count, taskPool.size());
        }
        return count;
    }

    @Override
    public Optional<QueuedTask> selectQueuedTask(TaskSource source) {
        return taskPool.poll().map(PoolEntry::getTask);
    }

    @Override
    public int selectCpu(TaskSource source, QueuedTask task) {
        return CpuSelector.delegate(source, task);
    }

    @Override
    public long determineTimeSlice(TaskSource source, QueuedTask task) {
        return strategyStore.lookup(task.pid())
                .map(SchedulingStrategy::executionTime)
                .filter(executionTime -> executionTime > 0)
                .orElse(0L);
    }

    @Override
    public int getPoolCount() {
        return taskPool.size();
    }

    @Override
    public void sendMetrics(Object data) {
        MetricsClient client = metricsClient;
        if (client == null) {
            return;
        }
        if (!(data instanceof BssData bssData)) {
            log.warn("Invalid metrics data type: {}", data == null ? "null" : data.getClass().getName());
            return;
        }
        try {
            client.sendMetrics(bssData);
        } catch (MetricsPushException e) {
            // Metrics must never disrupt scheduling
            log.warn("Failed to send metrics: {}", e.getMessage());
        }
    }

    @Override
    public StrategyChanges getChangedStrategies() {
        return strategyStore.drainChanges();
    }

    @Override
    public void close() {
        StrategyFetcher fetcher = strategyFetcher;
        if (fetcher != null) {
            fetcher.stop();
        }
    }

    /**
     * Replace the strategy overrides.
     */
    public void updateStrategyMap(Collection<SchedulingStrategy> strategies) {
        strategyStore.replace(strategies);
    }

    public StrategyStore getStrategyStore() {
        return strategyStore;
    }

    /**
     * Update the slice parameters. Zero leaves a value unchanged.
     */
    public void setSchedulerConfig(long sliceNsDefault, long sliceNsMin) {
        if (sliceNsDefault > 0) {
            this.sliceNsDefault = sliceNsDefault;
        }
        if (sliceNsMin > 0) {
            this.sliceNsMin = sliceNsMin;
        }
    }

    public SchedulerConfig getSchedulerConfig() {
        return new SchedulerConfig(sliceNsDefault, sliceNsMin, taskPool.getCapacity());
    }

    public long getMinVruntime() {
        return minVruntime.get();
    }

    public void setMetricsClient(MetricsClient metricsClient) {
        this.metricsClient = metricsClient;
    }

    public MetricsClient getMetricsClient() {
        return metricsClient;
    }

    public void setStrategyFetcher(StrategyFetcher strategyFetcher) {
        this.strategyFetcher = strategyFetcher;
    }

    public StrategyFetcher getStrategyFetcher() {
        return strategyFetcher;
    }

    /**
     * Deadline for a task being admitted.
     */
    long computeDeadline(QueuedTask task) {
        Optional<SchedulingStrategy> strategy = strategyStore.lookup(task.tgid());
        if (strategy.isPresent()) {
            // Overridden tasks only lift the clock off 0, never to their vtime
            minVruntime.accumulateAndGet(VirtualTime.MIN_KEY, VirtualTime::advance);
            // Priority tasks get the minimum deadline; 0 is kept as is
            return strategy.get().priority() ? 0L : Math.max(task.vtime(), 0L);
        }

        long slice = sliceNsDefault;
        long vtime = Math.max(task.vtime(), 0L);
        long clock = minVruntime.accumulateAndGet(Math.max(vtime, VirtualTime.MIN_KEY), VirtualTime::advance);
        long floor = VirtualTime.saturatingSub(clock, slice);

        long deadline;
        if (vtime == 0) {
            deadline = VirtualTime.saturatingAdd(floor, VirtualTime.scale(slice, 100, task.effectiveWeight()));
        } else {
            deadline = Math.max(vtime, floor);
        }

        long observedRuntime = VirtualTime.saturatingSub(task.stopTs(), task.startTs());
        deadline = VirtualTime.saturatingAdd(deadline, VirtualTime.scale(observedRuntime, Math.max(task.weight(), 0L), 100));
        return VirtualTime.nonZero(deadline);
    }
}
