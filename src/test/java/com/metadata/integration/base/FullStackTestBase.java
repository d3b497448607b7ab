package com.metadata.integration.base;

import com.metadata.infrastructure.store.StoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Base class for all integration tests.
 * Starts a PostgreSQL container and points {@code app.store.*} at it.
 *
 * Uses a lazy-initialized singleton container - shared across all tests, only started
 * when Docker is available.
 */
public abstract class FullStackTestBase {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    private static volatile boolean containerStarted = false;
    private static volatile boolean containerFailed = false;

    @BeforeEach
    void cleanAllData() {
        jdbcTemplate.update("DELETE FROM metadata_manager_user");
    }

    public static boolean isDockerAvailable() {
        if (containerFailed) {
            return false;
        }
        try {
            return DockerClientFactory.instance().isDockerAvailable();
        } catch (Exception e) {
            return false;
        }
    }

    /**
     * Store settings for the running container, for clients that connect without Spring.
     */
    protected static StoreProperties containerStoreProperties() {
        StoreProperties props = new StoreProperties();
        props.setHost(ContainerHolder.postgres.getHost());
        props.setPort(ContainerHolder.postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT));
        props.setDatabase(ContainerHolder.postgres.getDatabaseName());
        props.setUsername(ContainerHolder.postgres.getUsername());
        props.setPassword(ContainerHolder.postgres.getPassword());
        return props;
    }

    // Lazy initialization holder - container only created when first accessed
    // Lifecycle managed via shutdown hook, not try-with-resources
    @SuppressWarnings("resource")
    private static class ContainerHolder {
        static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
                .withReuse(true);
    }

    private static synchronized void startContainerIfNeeded() {
        if (containerStarted || containerFailed) {
            return;
        }
        try {
            ContainerHolder.postgres.start();
            containerStarted = true;
            Runtime.getRuntime().addShutdownHook(new Thread(ContainerHolder.postgres::close));
        } catch (Exception e) {
            containerFailed = true;
            throw e;
        }
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        if (!isDockerAvailable()) {
            // Dummy values so the context can be built; the tests themselves are skipped
            registerDummyStore(registry);
            return;
        }

        try {
            startContainerIfNeeded();
        } catch (Exception e) {
            registerDummyStore(registry);
            return;
        }

        registry.add("app.store.host", ContainerHolder.postgres::getHost);
        registry.add("app.store.port", () -> ContainerHolder.postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT));
        registry.add("app.store.database", ContainerHolder.postgres::getDatabaseName);
        registry.add("app.store.username", ContainerHolder.postgres::getUsername);
        registry.add("app.store.password", ContainerHolder.postgres::getPassword);
    }

    private static void registerDummyStore(DynamicPropertyRegistry registry) {
        registry.add("app.store.host", () -> "localhost");
        registry.add("app.store.port", () -> 5432);
        registry.add("app.store.database", () -> "dummy");
        registry.add("app.store.username", () -> "dummy");
        registry.add("app.store.password", () -> "dummy");
    }
}
