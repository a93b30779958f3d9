package com.sched.plugin.gthulhu;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sched.config.MtlsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.spec.X509EncodedKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP client for the API server with bearer-token authentication.
 * <p>
 * A token is obtained by posting the plugin's PEM public key to {@code /api/v1/auth/token}
 * and cached until the expiry the server reports. With mutual TLS enabled the underlying
 * client presents the plugin certificate and verifies the server against the private CA.
 */
public class JwtClient {

    private static final Logger log = LoggerFactory.getLogger(JwtClient.class);

    static final Duration TIMEOUT = Duration.ofSeconds(30);
    static final String TOKEN_PATH = "/api/v1/auth/token";

    private static final Pattern PUBLIC_KEY = Pattern.compile(
            "-----BEGIN PUBLIC KEY-----(.*?)-----END PUBLIC KEY-----", Pattern.DOTALL);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String publicKeyPath;
    private final String apiBaseUrl;
    private final boolean authEnabled;
    private final HttpClient httpClient;

    private String token;
    private Instant tokenExpiresAt = Instant.EPOCH;

    /**
     * @throws com.sched.exception.ConfigurationException if mTLS is enabled with invalid material
     */
    public JwtClient(String publicKeyPath, String apiBaseUrl, boolean authEnabled, MtlsConfig mtls) {
        this.publicKeyPath = publicKeyPath;
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        this.authEnabled = authEnabled;

        HttpClient.Builder builder = HttpClient.newBuilder().connectTimeout(TIMEOUT);
        if (mtls != null && mtls.enable()) {
            builder.sslContext(MtlsContextFactory.create(mtls));
            log.info("JWT client using mutual TLS for {}", this.apiBaseUrl);
        }
        this.httpClient = builder.build();
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public boolean isAuthEnabled() {
        return authEnabled;
    }

    /**
     * Send a request, adding the bearer token when authentication is enabled.
     *
     * @param method HTTP method
     * @param url    Absolute URL
     * @param body   JSON body, or null for none
     */
    public HttpResponse<String> send(String method, String url, String body)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (authEnabled) {
            request.header("Authorization", "Bearer " + ensureValidToken());
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    /**
     * Current token, requesting a new one if missing or expired.
     */
    synchronized String ensureValidToken() throws IOException, InterruptedException {
        if (token == null || Instant.now().isAfter(tokenExpiresAt)) {
            requestToken();
        }
        return token;
    }

    private void requestToken() throws IOException, InterruptedException {
        String publicKeyPem = loadPublicKey();
        String requestBody = objectMapper.writeValueAsString(new TokenRequest(publicKeyPem));

        HttpRequest request = HttpRequest.newBuilder(URI.create(apiBaseUrl + TOKEN_PATH))
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IOException("token request failed: " + describeError(response));
        }

        TokenResponse tokenResponse;
        try {
            tokenResponse = objectMapper.readValue(response.body(), TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new IOException("failed to parse token response", e);
        }
        if (!tokenResponse.success() || tokenResponse.data() == null
                || tokenResponse.data().token() == null || tokenResponse.data().token().isEmpty()) {
            throw new IOException("token request unsuccessful");
        }

        this.token = tokenResponse.data().token();
        this.tokenExpiresAt = Instant.ofEpochSecond(tokenResponse.data().expiredAt());
        log.debug("Obtained API token, expires at {}", tokenExpiresAt);
    }

    /**
     * Read the PEM public key and check that it parses.
     */
    String loadPublicKey() throws IOException {
        if (publicKeyPath == null || publicKeyPath.isBlank()) {
            throw new IOException("no public key path configured");
        }
        String pem = Files.readString(Path.of(publicKeyPath));
        Matcher matcher = PUBLIC_KEY.matcher(pem);
        if (!matcher.find()) {
            throw new IOException("failed to decode PEM block containing public key");
        }
        try {
            byte[] der = Base64.getMimeDecoder().decode(matcher.group(1).trim());
            X509EncodedKeySpec spec = new X509EncodedKeySpec(der);
            parsePublicKey(spec);
        } catch (IllegalArgumentException e) {
            throw new IOException("failed to parse public key: " + e.getMessage(), e);
        }
        return pem;
    }

    private static void parsePublicKey(X509EncodedKeySpec spec) throws IOException {
        GeneralSecurityException last = null;
        for (String algorithm : new String[]{"RSA", "EC"}) {
            try {
                KeyFactory.getInstance(algorithm).generatePublic(spec);
                return;
            } catch (GeneralSecurityException e) {
                last = e;
            }
        }
        throw new IOException("failed to parse public key", last);
    }

    private String describeError(HttpResponse<String> response) {
        try {
            ErrorResponse error = objectMapper.readValue(response.body(), ErrorResponse.class);
            if (error.error() != null) {
                return error.error();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not JSON", e);
        }
        return "status " + response.statusCode() + ": " + response.body();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    record TokenRequest(@JsonProperty("public_key") String publicKey) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenData(
            @JsonProperty("token") String token,
            @JsonProperty("expired_at") long expiredAt
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
            @JsonProperty("success") boolean success,
            @JsonProperty("data") TokenData data,
            @JsonProperty("timestamp") String timestamp
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorResponse(
            @JsonProperty("success") boolean success,
            @JsonProperty("error") String error
    ) {
    }
}
