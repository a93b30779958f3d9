package com.sched.config;

/**
 * API server settings, used only by the strategy fetcher and metrics client.
 *
 * @param publicKeyPath   PEM public key sent when requesting a token
 * @param baseUrl         API server base URL
 * @param intervalSeconds Strategy refresh interval
 * @param enabled         Whether the API collaborators are started
 * @param authEnabled     Whether requests carry a bearer token
 * @param mtls            Mutual TLS material
 */
public record ApiConfig(
        String publicKeyPath,
        String baseUrl,
        int intervalSeconds,
        boolean enabled,
        boolean authEnabled,
        MtlsConfig mtls
) {
    public static final int DEFAULT_INTERVAL_SECONDS = 10;

    public ApiConfig {
        if (intervalSeconds <= 0) {
            intervalSeconds = DEFAULT_INTERVAL_SECONDS;
        }
        if (mtls == null) {
            mtls = MtlsConfig.disabled();
        }
    }

    public static ApiConfig disabled() {
        return new ApiConfig(null, null, DEFAULT_INTERVAL_SECONDS, false, false, MtlsConfig.disabled());
    }

    /**
     * Whether there is enough configuration to talk to the API server.
     */
    public boolean isUsable() {
        return enabled && baseUrl != null && !baseUrl.isBlank();
    }
}
