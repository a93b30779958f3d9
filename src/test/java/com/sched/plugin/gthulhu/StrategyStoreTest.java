package com.sched.plugin.gthulhu;

import com.sched.plugin.SchedulingStrategy;
import com.sched.plugin.StrategyChanges;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StrategyStore.
 */
class StrategyStoreTest {

    private static List<SchedulingStrategy> generation(long executionTime, int count) {
        List<SchedulingStrategy> strategies = new ArrayList<>();
        for (int id = 1; id <= count; id++) {
            strategies.add(new SchedulingStrategy(false, executionTime, id));
        }
        return strategies;
    }

    @Test
    @DisplayName("Should look up strategies by id")
    void shouldLookUpById() {
        StrategyStore store = new StrategyStore();
        assertTrue(store.lookup(1).isEmpty());

        store.replace(List.of(new SchedulingStrategy(true, 100, 1), new SchedulingStrategy(false, 200, 2)));

        assertTrue(store.lookup(1).orElseThrow().priority());
        assertEquals(200, store.lookup(2).orElseThrow().executionTime());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("Later entries should win for duplicate ids")
    void laterEntriesShouldWin() {
        StrategyStore store = new StrategyStore();
        store.replace(List.of(new SchedulingStrategy(false, 1, 5), new SchedulingStrategy(true, 2, 5)));
        assertEquals(new SchedulingStrategy(true, 2, 5), store.lookup(5).orElseThrow());
    }

    @Test
    @DisplayName("Replace should remove ids missing from the new set")
    void replaceShouldRemoveMissingIds() {
        StrategyStore store = new StrategyStore();
        store.replace(List.of(new SchedulingStrategy(true, 0, 1), new SchedulingStrategy(true, 0, 2)));
        store.replace(List.of(new SchedulingStrategy(true, 0, 2)));

        assertTrue(store.lookup(1).isEmpty());
        assertTrue(store.lookup(2).isPresent());

        store.replace(null);
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Should track added, changed and removed strategies")
    void shouldTrackDeltas() {
        StrategyStore store = new StrategyStore();
        SchedulingStrategy a = new SchedulingStrategy(true, 0, 1);
        SchedulingStrategy b = new SchedulingStrategy(false, 100, 2);
        SchedulingStrategy b2 = new SchedulingStrategy(false, 300, 2);
        SchedulingStrategy c = new SchedulingStrategy(false, 50, 3);

        store.replace(List.of(a, b));
        StrategyChanges first = store.drainChanges();
        assertEquals(2, first.added().size());
        assertTrue(first.removed().isEmpty());

        store.replace(List.of(b2, c));
        StrategyChanges second = store.drainChanges();
        assertTrue(second.added().containsAll(List.of(b2, c)));
        assertEquals(2, second.added().size());
        assertTrue(second.removed().containsAll(List.of(a, b)));
        assertEquals(2, second.removed().size());

        // Same content again: nothing to report
        store.replace(List.of(b2, c));
        assertTrue(store.drainChanges().isEmpty());
    }

    @Test
    @DisplayName("Readers should see either the old or the new snapshot, never a mix")
    void readersShouldSeeWholeSnapshots() throws Exception {
        StrategyStore store = new StrategyStore();
        store.replace(generation(1, 64));

        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch readersStarted = new CountDownLatch(4);
        ExecutorService executor = Executors.newFixedThreadPool(5);
        try {
            List<Future<Integer>> readers = new ArrayList<>();
            for (int r = 0; r < 4; r++) {
                readers.add(executor.submit(() -> {
                    readersStarted.countDown();
                    int mixed = 0;
                    while (running.get()) {
                        Map<Integer, SchedulingStrategy> snapshot = store.snapshot();
                        long seen = snapshot.values().stream()
                                .mapToLong(SchedulingStrategy::executionTime)
                                .distinct()
                                .count();
                        if (seen != 1 || snapshot.size() != 64) {
                            mixed++;
                        }
                    }
                    return mixed;
                }));
            }

            Future<?> writer = executor.submit(() -> {
                for (int i = 0; i < 2000; i++) {
                    store.replace(generation(i % 2 == 0 ? 2 : 1, 64));
                }
            });

            assertTrue(readersStarted.await(5, TimeUnit.SECONDS));
            writer.get(30, TimeUnit.SECONDS);
            running.set(false);
            for (Future<Integer> reader : readers) {
                assertEquals(0, reader.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Snapshot should be immutable")
    void snapshotShouldBeImmutable() {
        StrategyStore store = new StrategyStore();
        store.replace(generation(1, 3));
        Map<Integer, SchedulingStrategy> snapshot = store.snapshot();
        assertThrows(UnsupportedOperationException.class,
                () -> snapshot.put(9, new SchedulingStrategy(true, 0, 9)));
    }
}
