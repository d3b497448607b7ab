package com.metadata.client;

import com.metadata.client.ApiResponse.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Runs a {@link RestClient} request and folds the outcome into an {@link ApiResponse}.
 */
final class RestResponses {

    private static final Logger log = LoggerFactory.getLogger(RestResponses.class);

    private RestResponses() {}

    static <T> ApiResponse<T> exchange(RestClient.RequestHeadersSpec<?> spec, ParameterizedTypeReference<T> type) {
        return spec.exchange((request, response) -> {
            HttpStatusCode status = response.getStatusCode();
            log.debug("{} {} -> {}", request.getMethod(), request.getURI(), status.value());

            if (status.is2xxSuccessful()) {
                T body = status.value() == 204 ? null : response.bodyTo(type);
                return new ApiResponse<>(status.value(), body, null);
            }

            ApiError error;
            try {
                error = response.bodyTo(ApiError.class);
            } catch (RestClientException e) {
                log.debug("Error body from {} is not an error payload: {}", request.getURI(), e.getMessage());
                error = null;
            }
            if (error == null) {
                error = new ApiError(null, null, null);
            }
            return new ApiResponse<>(status.value(), null, error);
        });
    }
}
