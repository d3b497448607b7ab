package com.metadata.infrastructure.config;

import com.metadata.infrastructure.store.StoreHostResolver;
import com.metadata.infrastructure.store.StoreProperties;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Builds the connection pool from the explicit {@code app.store.*} settings instead of
 * Spring's {@code spring.datasource.*} auto-configuration.
 */
@Configuration
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    private final AppProperties appProperties;

    public DataSourceConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Bean
    public StoreHostResolver storeHostResolver() {
        return new StoreHostResolver();
    }

    @Bean
    public DataSource dataSource(StoreHostResolver storeHostResolver) {
        StoreProperties store = appProperties.getStore();
        store.requireComplete();

        String host = storeHostResolver.resolve(store);

        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(store.jdbcUrl(host));
        dataSource.setUsername(store.getUsername());
        dataSource.setPassword(store.getPassword());
        dataSource.setMaximumPoolSize(store.getMaxPoolSize());
        dataSource.setMinimumIdle(store.getMinIdle());
        dataSource.setPoolName("user-store");

        log.info("User store at {}:{}/{}", host, store.getPort(), store.getDatabase());
        return dataSource;
    }
}
