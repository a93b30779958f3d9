package com.sched.plugin.gthulhu;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sched.plugin.SchedulingStrategy;

import java.util.List;

/**
 * Response body of the strategy endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulingStrategiesResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("scheduling") List<SchedulingStrategy> scheduling
) {
}
