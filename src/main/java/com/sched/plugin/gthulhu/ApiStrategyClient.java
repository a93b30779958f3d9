package com.sched.plugin.gthulhu;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sched.exception.OverrideFetchException;
import com.sched.plugin.SchedulingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.List;

/**
 * Fetches strategy overrides from the API server.
 */
public class ApiStrategyClient implements StrategyClient {

    private static final Logger log = LoggerFactory.getLogger(ApiStrategyClient.class);

    static final String STRATEGIES_PATH = "/api/v1/scheduling/strategies";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JwtClient jwtClient;
    private final String strategiesUrl;

    public ApiStrategyClient(JwtClient jwtClient) {
        this.jwtClient = jwtClient;
        this.strategiesUrl = jwtClient.getApiBaseUrl() + STRATEGIES_PATH;
    }

    @Override
    public List<SchedulingStrategy> fetchStrategies() {
        HttpResponse<String> response;
        try {
            response = jwtClient.send("GET", strategiesUrl, null);
        } catch (IOException e) {
            throw new OverrideFetchException("strategy request to " + strategiesUrl + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OverrideFetchException("strategy request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new OverrideFetchException("strategy request failed with status code: " + response.statusCode());
        }

        SchedulingStrategiesResponse body;
        try {
            body = objectMapper.readValue(response.body(), SchedulingStrategiesResponse.class);
        } catch (JsonProcessingException e) {
            throw new OverrideFetchException("failed to parse strategy response", e);
        }

        // Only update if successful
        if (!body.success()) {
            log.debug("Strategy endpoint reported failure: {}", body.message());
            return null;
        }
        return body.scheduling() != null ? body.scheduling() : List.of();
    }
}
