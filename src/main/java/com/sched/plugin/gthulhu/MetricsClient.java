package com.sched.plugin.gthulhu;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sched.exception.MetricsPushException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Pushes {@link BssData} to the API server.
 * Sends closer together than the minimum interval are skipped.
 */
public class MetricsClient {

    private static final Logger log = LoggerFactory.getLogger(MetricsClient.class);

    static final String METRICS_PATH = "/api/v1/metrics";
    static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JwtClient jwtClient;
    private final String metricsUrl;
    private final Duration minInterval;
    private final Clock clock;
    private volatile Instant lastSentAt;

    public MetricsClient(JwtClient jwtClient) {
        this(jwtClient, DEFAULT_MIN_INTERVAL, Clock.systemUTC());
    }

    public MetricsClient(JwtClient jwtClient, Duration minInterval, Clock clock) {
        this.jwtClient = jwtClient;
        this.metricsUrl = jwtClient.getApiBaseUrl() + METRICS_PATH;
        this.minInterval = minInterval;
        this.clock = clock;
    }

    /**
     * Push the metrics unless the last successful push is too recent.
     *
     * @return true if the metrics were sent, false if the push was skipped
     * @throws MetricsPushException if the push failed
     */
    public boolean sendMetrics(BssData data) {
        Instant now = clock.instant();
        Instant last = lastSentAt;
        if (last != null && Duration.between(last, now).compareTo(minInterval) < 0) {
            return false;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new MetricsPushException("failed to marshal metrics data", e);
        }

        HttpResponse<String> response;
        try {
            response = jwtClient.send("POST", metricsUrl, json);
        } catch (IOException e) {
            throw new MetricsPushException("failed to send metrics request: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricsPushException("metrics request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new MetricsPushException("metrics request failed with status code: " + response.statusCode());
        }

        lastSentAt = now;
        log.debug("Sent metrics to API server");
        return true;
    }
}
