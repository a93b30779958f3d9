package com.sched.adapter.spring;

import com.sched.config.ConfigLoader;
import com.sched.config.SchedConfig;
import com.sched.plugin.CustomScheduler;
import com.sched.plugin.PluginContext;
import com.sched.plugin.PluginRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the scheduler plugin.
 * A scheduler that cannot be created fails application startup.
 */
@Configuration
@ConditionalOnProperty(prefix = "sched", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchedulerAutoConfiguration.class);

    private PluginContext pluginContext;
    private CustomScheduler customScheduler;

    @Bean
    @ConditionalOnMissingBean
    public SchedConfig schedConfig(SchedulerProperties properties) {
        log.info("Loading scheduler configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PluginRegistry pluginRegistry() {
        return PluginRegistry.withDiscoveredPlugins();
    }

    @Bean
    @ConditionalOnMissingBean
    public PluginContext pluginContext() {
        this.pluginContext = new PluginContext("scheduler");
        return this.pluginContext;
    }

    @Bean
    @ConditionalOnMissingBean
    public CustomScheduler customScheduler(PluginRegistry registry, PluginContext context, SchedConfig config) {
        log.info("Creating scheduler plugin for mode: {}", config.mode());
        this.customScheduler = registry.create(context, config);
        return this.customScheduler;
    }

    @PreDestroy
    public void shutdown() {
        if (customScheduler != null) {
            log.info("Closing scheduler plugin");
            customScheduler.close();
        }
        if (pluginContext != null) {
            pluginContext.cancel();
        }
    }
}
