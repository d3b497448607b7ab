package com.metadata.client;

public record HealthStatus(String status) {

    public boolean isOk() {
        return "ok".equals(status);
    }
}
