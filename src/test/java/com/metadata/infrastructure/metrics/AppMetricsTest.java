package com.metadata.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppMetricsTest {

    private SimpleMeterRegistry registry;
    private AppMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AppMetrics(registry);
    }

    @Test
    void shouldCountLifecycleEvents() {
        metrics.incrementUsersCreated();
        metrics.incrementUsersCreated();
        metrics.incrementUsersUpdated();
        metrics.incrementUsersDeleted();

        assertEquals(2.0, registry.get("users_created_total").counter().count());
        assertEquals(1.0, registry.get("users_updated_total").counter().count());
        assertEquals(1.0, registry.get("users_deleted_total").counter().count());
    }

    @Test
    void shouldTagRejectionsByCode() {
        metrics.incrementRejectedMutations("ID_INVALID_CHECKSUM");
        metrics.incrementRejectedMutations("ID_INVALID_CHECKSUM");
        metrics.incrementRejectedMutations("USER_ALREADY_EXISTS");

        assertEquals(2.0, registry.get("user_mutations_rejected_total")
            .tag("code", "ID_INVALID_CHECKSUM").counter().count());
        assertEquals(1.0, registry.get("user_mutations_rejected_total")
            .tag("code", "USER_ALREADY_EXISTS").counter().count());
    }
}
