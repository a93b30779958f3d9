package com.sched;

import com.sched.adapter.source.InMemoryTaskSource;
import com.sched.config.ConfigLoader;
import com.sched.config.SchedConfig;
import com.sched.core.DispatchLoop;
import com.sched.model.QueuedTask;
import com.sched.plugin.CustomScheduler;
import com.sched.plugin.PluginContext;
import com.sched.plugin.PluginRegistry;
import com.sched.plugin.SchedulingStrategy;
import com.sched.plugin.gthulhu.GthulhuPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: configuration, registry and dispatch loop together.
 * Tests cover:
 * - Every built-in mode dispatching a full batch
 * - Policy-specific ordering through the loop
 * - Overrides reaching the deadline policy
 */
class SchedulerApplicationTest {

    private PluginRegistry registry;
    private PluginContext context;

    @BeforeEach
    void setUp() {
        registry = PluginRegistry.withDiscoveredPlugins();
        context = new PluginContext("e2e");
    }

    @AfterEach
    void tearDown() {
        context.cancel();
    }

    private static InMemoryTaskSource batch() {
        InMemoryTaskSource source = new InMemoryTaskSource();
        source.submit(QueuedTask.of(1, 100, 5000, 1));
        source.submit(QueuedTask.of(2, 100, 3000, 2));
        source.submit(QueuedTask.of(3, 100, 7000, 3));
        return source;
    }

    private static List<Integer> pids(List<DispatchLoop.Dispatch> dispatched) {
        return dispatched.stream().map(d -> d.task().pid()).toList();
    }

    @ParameterizedTest
    @ValueSource(strings = {"simple", "simple-fifo", "gthulhu"})
    @DisplayName("Every built-in mode should dispatch the whole batch")
    void everyModeShouldDispatchBatch(String mode) {
        try (CustomScheduler scheduler = registry.create(context, SchedConfig.of(mode))) {
            InMemoryTaskSource source = batch();
            List<DispatchLoop.Dispatch> dispatched = new DispatchLoop(scheduler, source, 5_000_000L).run(10);

            assertEquals(3, dispatched.size());
            assertEquals(0, scheduler.getPoolCount());
            assertTrue(dispatched.stream().allMatch(d -> d.sliceNs() > 0));
        }
    }

    @Test
    @DisplayName("FIFO and vtime modes should order the same batch differently")
    void modesShouldOrderDifferently() {
        CustomScheduler fifo = registry.create(context, SchedConfig.of("simple-fifo"));
        CustomScheduler weighted = registry.create(context, SchedConfig.of("simple"));
        CustomScheduler deadline = registry.create(context, SchedConfig.of("gthulhu"));

        assertEquals(List.of(1, 2, 3), pids(new DispatchLoop(fifo, batch(), 5_000_000L).run(10)));
        assertEquals(List.of(2, 1, 3), pids(new DispatchLoop(weighted, batch(), 5_000_000L).run(10)));
        assertEquals(List.of(2, 1, 3), pids(new DispatchLoop(deadline, batch(), 5_000_000L).run(10)));
    }

    @Test
    @DisplayName("Override from configuration-driven plugin should win the dispatch")
    void overrideShouldWinDispatch() {
        SchedConfig config = ConfigLoader.load("classpath:scheduler.yaml");
        GthulhuPlugin plugin = (GthulhuPlugin) registry.create(context, config);
        plugin.updateStrategyMap(List.of(new SchedulingStrategy(true, 2_000_000L, 3)));

        List<DispatchLoop.Dispatch> dispatched = new DispatchLoop(plugin, batch(), 5_000_000L).run(10);

        assertEquals(List.of(3, 2, 1), pids(dispatched));
        assertEquals(2_000_000L, dispatched.get(0).sliceNs());
        assertEquals(1, plugin.getChangedStrategies().added().size());
    }
}
