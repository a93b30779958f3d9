package com.sched.plugin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Externally supplied per-task override.
 *
 * @param priority      Force the task's key to the minimum on admission
 * @param executionTime Time slice to use for the task in nanoseconds, 0 for none
 * @param pid           Target process or thread-group id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulingStrategy(
        @JsonProperty("priority") boolean priority,
        @JsonProperty("execution_time") long executionTime,
        @JsonProperty("pid") int pid
) {
}
