package com.metadata.client;

/**
 * What the server answered: the status code plus either the decoded body (2xx) or the decoded
 * error payload (everything else). Non-2xx statuses are returned, never thrown.
 */
public record ApiResponse<T>(int statusCode, T body, ApiError error) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Error payload written by the server. Fields are null when the body could not be decoded.
     */
    public record ApiError(String error, String message, String requestId) {}
}
