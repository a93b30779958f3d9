package com.sched.plugin;

/**
 * Service provider that registers one or more plugin modes.
 * Implementations are listed in {@code META-INF/services/com.sched.plugin.PluginProvider}
 * and picked up by {@link PluginRegistry#withDiscoveredPlugins()}.
 */
public interface PluginProvider {

    void registerPlugins(PluginRegistry registry);
}
