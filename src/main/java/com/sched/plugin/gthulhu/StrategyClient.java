package com.sched.plugin.gthulhu;

import com.sched.exception.OverrideFetchException;
import com.sched.plugin.SchedulingStrategy;

import java.util.List;

/**
 * Source of strategy overrides.
 */
@FunctionalInterface
public interface StrategyClient {

    /**
     * Fetch the current overrides.
     *
     * @return The strategies, or null when the server reported an unsuccessful response
     * @throws OverrideFetchException if the fetch failed
     */
    List<SchedulingStrategy> fetchStrategies();
}
