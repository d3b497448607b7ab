package com.metadata.client;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

public class HealthApiClient {

    private static final ParameterizedTypeReference<HealthStatus> HEALTH = new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public HealthApiClient(RestClient restClient) {
        this.restClient = restClient;
    }

    /** {@code GET /api/health/} */
    public ApiResponse<HealthStatus> check() {
        return RestResponses.exchange(restClient.get().uri("/api/health/"), HEALTH);
    }
}
