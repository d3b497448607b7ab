package com.metadata.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementUsersCreated();

    void incrementUsersUpdated();

    void incrementUsersDeleted();

    void incrementRejectedMutations(String code);
}
