package com.metadata.infrastructure.metrics;

import com.metadata.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;

    private final Counter usersCreated;
    private final Counter usersUpdated;
    private final Counter usersDeleted;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.usersCreated = Counter.builder("users_created_total")
            .description("Total number of users created")
            .register(registry);

        this.usersUpdated = Counter.builder("users_updated_total")
            .description("Total number of full or partial user updates")
            .register(registry);

        this.usersDeleted = Counter.builder("users_deleted_total")
            .description("Total number of users deleted")
            .register(registry);
    }

    @Override
    public void incrementUsersCreated() {
        usersCreated.increment();
    }

    @Override
    public void incrementUsersUpdated() {
        usersUpdated.increment();
    }

    @Override
    public void incrementUsersDeleted() {
        usersDeleted.increment();
    }

    @Override
    public void incrementRejectedMutations(String code) {
        // One series per error code; codes are a small fixed set.
        Counter.builder("user_mutations_rejected_total")
            .description("User mutations rejected by validation or conflict")
            .tag("code", code)
            .register(registry)
            .increment();
    }
}
