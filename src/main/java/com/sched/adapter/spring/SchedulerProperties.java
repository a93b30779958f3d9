package com.sched.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the scheduler plugin.
 */
@ConfigurationProperties(prefix = "sched")
public class SchedulerProperties {

    /**
     * Whether the scheduler plugin is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the scheduler configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:scheduler.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
