package com.sched.config;

/**
 * Configuration bundle passed to a plugin factory.
 *
 * @param mode      Registered plugin name (e.g. "gthulhu", "simple", "simple-fifo")
 * @param scheduler Time-slice and pool parameters
 * @param api       API server settings
 */
public record SchedConfig(
        String mode,
        SchedulerConfig scheduler,
        ApiConfig api
) {
    public SchedConfig {
        if (scheduler == null) {
            scheduler = SchedulerConfig.defaults();
        }
        if (api == null) {
            api = ApiConfig.disabled();
        }
    }

    /**
     * Create a configuration with only a mode and slice settings.
     */
    public static SchedConfig of(String mode, long sliceNsDefault, long sliceNsMin) {
        return new SchedConfig(mode, new SchedulerConfig(sliceNsDefault, sliceNsMin), ApiConfig.disabled());
    }

    /**
     * Create a configuration with only a mode, everything else defaulted.
     */
    public static SchedConfig of(String mode) {
        return new SchedConfig(mode, SchedulerConfig.defaults(), ApiConfig.disabled());
    }
}
