package com.metadata.client;

import java.time.Duration;

/**
 * Connection settings for {@link MetadataClient}.
 *
 * @param baseUrl server root, e.g. {@code http://localhost:8000}
 * @param token optional credential; when set every request carries {@code Authorization: <prefix> <token>}
 * @param prefix authorization scheme placed before the token
 * @param timeout connect and read timeout
 */
public record ClientConfig(String baseUrl, String token, String prefix, Duration timeout) {

    public static final String DEFAULT_PREFIX = "Bearer";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public ClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        if (prefix == null || prefix.isBlank()) {
            prefix = DEFAULT_PREFIX;
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
    }

    public static ClientConfig of(String baseUrl) {
        return new ClientConfig(baseUrl, null, DEFAULT_PREFIX, DEFAULT_TIMEOUT);
    }

    public ClientConfig withToken(String newToken) {
        return new ClientConfig(baseUrl, newToken, prefix, timeout);
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
