package com.sched.plugin.simple;

import com.sched.adapter.source.InMemoryTaskSource;
import com.sched.model.QueuedTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SimplePlugin in both modes.
 */
class SimplePluginTest {

    private static List<Integer> drainAndSelectAll(SimplePlugin plugin, InMemoryTaskSource source) {
        plugin.drainQueuedTask(source);
        List<Integer> pids = new ArrayList<>();
        Optional<QueuedTask> next;
        while ((next = plugin.selectQueuedTask(source)).isPresent()) {
            pids.add(next.get().pid());
        }
        return pids;
    }

    @Test
    @DisplayName("FIFO mode should select in arrival order regardless of vtime")
    void fifoShouldSelectInArrivalOrder() {
        SimplePlugin plugin = new SimplePlugin(true);
        InMemoryTaskSource source = new InMemoryTaskSource(List.of(
                QueuedTask.of(1, 100, 5000, 1),
                QueuedTask.of(2, 100, 3000, 2),
                QueuedTask.of(3, 100, 7000, 3)));

        assertEquals(List.of(1, 2, 3), drainAndSelectAll(plugin, source));
        assertEquals(1, plugin.getVtimeNow());
    }

    @Test
    @DisplayName("Weighted mode should select the lowest vtime first")
    void weightedShouldSelectLowestVtime() {
        SimplePlugin plugin = new SimplePlugin(false);
        InMemoryTaskSource source = new InMemoryTaskSource(List.of(
                QueuedTask.of(1, 100, 5000, 1),
                QueuedTask.of(2, 100, 3000, 2),
                QueuedTask.of(3, 100, 7000, 3)));

        assertEquals(List.of(2, 1, 3), drainAndSelectAll(plugin, source));
        assertEquals(7000, plugin.getVtimeNow());
    }

    @Test
    @DisplayName("Should return the selected task unchanged")
    void shouldReturnTaskUnchanged() {
        SimplePlugin plugin = new SimplePlugin(false);
        QueuedTask task = new QueuedTask(42, 3, 4, 0x1, 10, 20, 30, 100, 0, 40);
        InMemoryTaskSource source = new InMemoryTaskSource(List.of(task));

        plugin.drainQueuedTask(source);
        assertEquals(task, plugin.selectQueuedTask(source).orElseThrow());
    }

    @Test
    @DisplayName("Should discard invalid pids and keep draining")
    void shouldDiscardInvalidPids() {
        SimplePlugin plugin = new SimplePlugin(false);
        InMemoryTaskSource source = new InMemoryTaskSource(List.of(
                QueuedTask.of(0, 100, 10, 0),
                QueuedTask.of(-5, 100, 10, 0),
                QueuedTask.of(7, 100, 10, 7)));

        assertEquals(1, plugin.drainQueuedTask(source));
        assertEquals(1, plugin.getPoolCount());
        assertEquals(new SimplePlugin.Stats(1, 0, 2), plugin.getStats());

        plugin.resetStats();
        assertEquals(new SimplePlugin.Stats(0, 0, 0), plugin.getStats());
        assertEquals(1, plugin.getPoolCount());
    }

    @Test
    @DisplayName("Should stop draining at the sentinel")
    void shouldStopAtSentinel() {
        SimplePlugin plugin = new SimplePlugin(true);
        InMemoryTaskSource source = new InMemoryTaskSource(List.of(
                QueuedTask.of(1, 100, 0, 1),
                QueuedTask.NONE,
                QueuedTask.of(2, 100, 0, 2)));

        assertEquals(1, plugin.drainQueuedTask(source));
        assertEquals(1, source.getNrQueued());
    }

    @Test
    @DisplayName("Should never hold more than capacity - 1 tasks")
    void shouldRespectCapacity() {
        SimplePlugin plugin = new SimplePlugin(false, 4);
        InMemoryTaskSource source = new InMemoryTaskSource();
        for (int i = 1; i <= 10; i++) {
            source.submit(QueuedTask.of(i, 100, i * 10L, i));
        }

        assertEquals(3, plugin.drainQueuedTask(source));
        assertEquals(3, plugin.getPoolCount());
        // Capacity is checked before dequeueing, nothing was lost
        assertEquals(7, source.getNrQueued());
        assertEquals(0, plugin.drainQueuedTask(source));
    }

    @Test
    @DisplayName("Should clamp an idle task's vtime to one slice behind the clock")
    void shouldClampIdleVtime() {
        SimplePlugin plugin = new SimplePlugin(false);
        InMemoryTaskSource source = new InMemoryTaskSource(List.of(QueuedTask.of(1, 100, 10_000_000L, 1)));
        plugin.drainQueuedTask(source);
        plugin.selectQueuedTask(source);
        assertEquals(10_000_000L, plugin.getVtimeNow());

        source.submit(QueuedTask.of(2, 100, 0, 2));
        plugin.drainQueuedTask(source);

        long expected = 10_000_000L - SimplePlugin.DEFAULT_SLICE_NS;
        assertEquals(expected, plugin.getTaskPool().peek().orElseThrow().getKey());
    }

    @Test
    @DisplayName("Clock should never move backwards")
    void clockShouldBeMonotonic() {
        SimplePlugin plugin = new SimplePlugin(false);
        InMemoryTaskSource source = new InMemoryTaskSource();
        long previous = plugin.getVtimeNow();
        long[] vtimes = {9000, 100, 50_000, 20, 0, 70_000, 3};
        for (int i = 0; i < vtimes.length; i++) {
            source.submit(QueuedTask.of(i + 1, 100, vtimes[i], i + 1));
            plugin.drainQueuedTask(source);
            plugin.selectQueuedTask(source);
            long now = plugin.getVtimeNow();
            assertTrue(now >= previous, "clock went from " + previous + " to " + now);
            assertTrue(now > 0);
            previous = now;
        }
    }

    @Test
    @DisplayName("Should charge runtime scaled by inverse weight")
    void shouldChargeByInverseWeight() {
        SimplePlugin weighted = new SimplePlugin(false);
        QueuedTask task = QueuedTask.of(1, 200, 1000, 1);
        assertEquals(1500, weighted.chargeStoppedTask(task, 1000).vtime());

        // Zero weight counts as 1
        assertEquals(1000 + 100_000, weighted.chargeStoppedTask(QueuedTask.of(1, 0, 1000, 1), 1000).vtime());

        SimplePlugin fifo = new SimplePlugin(true);
        assertSame(task, fifo.chargeStoppedTask(task, 1000));
    }

    @Test
    @DisplayName("Time slice should be the configured default")
    void timeSliceShouldBeDefault() {
        SimplePlugin plugin = new SimplePlugin(false);
        QueuedTask task = QueuedTask.of(1, 100, 0, 1);
        assertEquals(SimplePlugin.DEFAULT_SLICE_NS, plugin.determineTimeSlice(null, task));

        plugin.setSliceDefault(2_000_000L);
        plugin.setSliceDefault(0);
        assertEquals(2_000_000L, plugin.determineTimeSlice(null, task));
    }

    @Test
    @DisplayName("Instances should not share pools or clocks")
    void instancesShouldBeIsolated() {
        SimplePlugin first = new SimplePlugin(false);
        SimplePlugin second = new SimplePlugin(false);
        InMemoryTaskSource source = new InMemoryTaskSource(List.of(QueuedTask.of(1, 100, 5000, 1)));

        first.drainQueuedTask(source);
        first.selectQueuedTask(source);

        assertEquals(5000, first.getVtimeNow());
        assertEquals(1, second.getVtimeNow());
        assertEquals(0, second.getPoolCount());
    }
}
