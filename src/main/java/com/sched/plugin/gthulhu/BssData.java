package com.sched.plugin.gthulhu;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scheduler counters pushed to the API server.
 */
public record BssData(
        @JsonProperty("usersched_last_run_at") long userschedLastRunAt,
        @JsonProperty("nr_queued") long nrQueued,
        @JsonProperty("nr_scheduled") long nrScheduled,
        @JsonProperty("nr_running") long nrRunning,
        @JsonProperty("nr_online_cpus") long nrOnlineCpus,
        @JsonProperty("nr_user_dispatches") long nrUserDispatches,
        @JsonProperty("nr_kernel_dispatches") long nrKernelDispatches,
        @JsonProperty("nr_cancel_dispatches") long nrCancelDispatches,
        @JsonProperty("nr_bounce_dispatches") long nrBounceDispatches,
        @JsonProperty("nr_failed_dispatches") long nrFailedDispatches,
        @JsonProperty("nr_sched_congested") long nrSchedCongested
) {
}
