package com.sched.plugin.gthulhu;

import com.sched.config.ApiConfig;
import com.sched.config.SchedConfig;
import com.sched.plugin.PluginContext;
import com.sched.plugin.PluginProvider;
import com.sched.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Registers the "gthulhu" mode.
 * <p>
 * With a usable API configuration the plugin also gets a metrics client and a strategy
 * fetcher bound to the creation context.
 */
public class GthulhuPluginProvider implements PluginProvider {

    private static final Logger log = LoggerFactory.getLogger(GthulhuPluginProvider.class);

    public static final String MODE = "gthulhu";

    @Override
    public void registerPlugins(PluginRegistry registry) {
        registry.register(MODE, GthulhuPluginProvider::create);
    }

    static GthulhuPlugin create(PluginContext context, SchedConfig config) {
        GthulhuPlugin plugin = new GthulhuPlugin(
                config.scheduler().sliceNsDefault(),
                config.scheduler().sliceNsMin(),
                config.scheduler().poolCapacity());

        ApiConfig api = config.api();
        if (!api.isUsable()) {
            log.info("API client disabled, strategy overrides only via updateStrategyMap");
            return plugin;
        }

        JwtClient jwtClient = new JwtClient(api.publicKeyPath(), api.baseUrl(), api.authEnabled(), api.mtls());
        plugin.setMetricsClient(new MetricsClient(jwtClient));

        StrategyFetcher fetcher = new StrategyFetcher(
                new ApiStrategyClient(jwtClient),
                plugin.getStrategyStore(),
                Duration.ofSeconds(api.intervalSeconds()));
        plugin.setStrategyFetcher(fetcher);
        fetcher.start(context);
        return plugin;
    }
}
