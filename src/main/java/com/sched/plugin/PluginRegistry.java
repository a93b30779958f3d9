package com.sched.plugin;

import com.sched.config.SchedConfig;
import com.sched.exception.AlreadyRegisteredException;
import com.sched.exception.InvalidArgumentException;
import com.sched.exception.PluginNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe map of plugin mode to factory.
 * <p>
 * Callers create policies by name through {@link #create(PluginContext, SchedConfig)}
 * without depending on concrete policy types. All operations are linearizable:
 * a {@code create} sees every {@code register} that happened before it.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final ConcurrentMap<String, PluginFactory> factories = new ConcurrentHashMap<>();

    /**
     * Create a registry populated by every {@link PluginProvider} on the classpath.
     */
    public static PluginRegistry withDiscoveredPlugins() {
        return withDiscoveredPlugins(PluginRegistry.class.getClassLoader());
    }

    public static PluginRegistry withDiscoveredPlugins(ClassLoader classLoader) {
        PluginRegistry registry = new PluginRegistry();
        for (PluginProvider provider : ServiceLoader.load(PluginProvider.class, classLoader)) {
            log.debug("Registering plugins from {}", provider.getClass().getName());
            provider.registerPlugins(registry);
        }
        log.info("Plugin registry initialized with modes: {}", registry.listRegistered());
        return registry;
    }

    /**
     * Register a factory for a mode.
     *
     * @throws InvalidArgumentException   if the mode is empty or the factory is null
     * @throws AlreadyRegisteredException if the mode is taken; the first registration stays
     */
    public void register(String mode, PluginFactory factory) {
        if (mode == null || mode.isEmpty()) {
            throw new InvalidArgumentException("plugin mode cannot be empty");
        }
        if (factory == null) {
            throw new InvalidArgumentException("plugin factory cannot be null");
        }
        PluginFactory existing = factories.putIfAbsent(mode, factory);
        if (existing != null) {
            throw new AlreadyRegisteredException("plugin mode '" + mode + "' is already registered");
        }
        log.debug("Registered plugin mode '{}'", mode);
    }

    /**
     * Create a policy for {@code config.mode()}.
     * Exceptions thrown by the factory propagate unchanged.
     *
     * @throws InvalidArgumentException if config is null
     * @throws PluginNotFoundException  if no factory is registered for the mode
     */
    public CustomScheduler create(PluginContext context, SchedConfig config) {
        if (config == null) {
            throw new InvalidArgumentException("config cannot be null");
        }
        PluginFactory factory = config.mode() == null ? null : factories.get(config.mode());
        if (factory == null) {
            throw new PluginNotFoundException("unknown plugin mode: " + config.mode());
        }
        PluginContext ctx = context != null ? context : PluginContext.background();
        CustomScheduler scheduler = factory.create(ctx, config);
        log.info("Created scheduler plugin '{}': {}", config.mode(),
                scheduler != null ? scheduler.getClass().getSimpleName() : "null");
        return scheduler;
    }

    /**
     * All registered modes, in no particular order.
     */
    public List<String> listRegistered() {
        return new ArrayList<>(factories.keySet());
    }

    public boolean isRegistered(String mode) {
        return mode != null && factories.containsKey(mode);
    }
}
