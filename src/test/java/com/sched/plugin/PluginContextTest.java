package com.sched.plugin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PluginContext cancellation.
 */
class PluginContextTest {

    @Test
    @DisplayName("Should run callbacks once, in registration order")
    void shouldRunCallbacksOnceInOrder() {
        List<String> calls = new ArrayList<>();
        PluginContext context = new PluginContext("test");
        context.onCancel(() -> calls.add("first"));
        context.onCancel(() -> calls.add("second"));

        context.cancel();
        context.cancel();

        assertTrue(context.isCancelled());
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    @DisplayName("Callback registered after cancel should run immediately")
    void lateCallbackShouldRunImmediately() {
        List<String> calls = new ArrayList<>();
        PluginContext context = PluginContext.background();
        context.close();

        context.onCancel(() -> calls.add("late"));

        assertEquals(List.of("late"), calls);
    }

    @Test
    @DisplayName("A failing callback should not stop the others")
    void failingCallbackShouldNotStopOthers() {
        List<String> calls = new ArrayList<>();
        PluginContext context = new PluginContext("test");
        context.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        context.onCancel(() -> calls.add("after"));

        assertDoesNotThrow(context::cancel);
        assertEquals(List.of("after"), calls);
    }
}
