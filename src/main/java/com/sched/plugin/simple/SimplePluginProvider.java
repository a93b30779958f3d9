package com.sched.plugin.simple;

import com.sched.config.SchedConfig;
import com.sched.plugin.PluginProvider;
import com.sched.plugin.PluginRegistry;

/**
 * Registers the "simple" (weighted vtime) and "simple-fifo" modes.
 */
public class SimplePluginProvider implements PluginProvider {

    public static final String MODE_WEIGHTED = "simple";
    public static final String MODE_FIFO = "simple-fifo";

    @Override
    public void registerPlugins(PluginRegistry registry) {
        registry.register(MODE_WEIGHTED, (ctx, config) -> create(false, config));
        registry.register(MODE_FIFO, (ctx, config) -> create(true, config));
    }

    private static SimplePlugin create(boolean fifoMode, SchedConfig config) {
        SimplePlugin plugin = new SimplePlugin(fifoMode, config.scheduler().poolCapacity());
        if (config.scheduler().sliceNsDefault() > 0) {
            plugin.setSliceDefault(config.scheduler().sliceNsDefault());
        }
        return plugin;
    }
}
