package com.sched.plugin;

import com.sched.config.SchedConfig;

/**
 * Creates a policy instance from a context and a configuration bundle.
 */
@FunctionalInterface
public interface PluginFactory {

    CustomScheduler create(PluginContext context, SchedConfig config);
}
