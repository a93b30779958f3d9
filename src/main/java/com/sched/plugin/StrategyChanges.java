package com.sched.plugin;

import java.util.List;

/**
 * Strategy overrides added and removed since the previous report.
 * A strategy whose settings changed appears in both lists: old value removed, new value added.
 *
 * @param added   Strategies that became active
 * @param removed Strategies that stopped being active
 */
public record StrategyChanges(
        List<SchedulingStrategy> added,
        List<SchedulingStrategy> removed
) {
    private static final StrategyChanges NONE = new StrategyChanges(List.of(), List.of());

    public StrategyChanges {
        added = added == null ? List.of() : List.copyOf(added);
        removed = removed == null ? List.of() : List.copyOf(removed);
    }

    public static StrategyChanges none() {
        return NONE;
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
