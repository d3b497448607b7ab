package com.metadata.infrastructure.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Connection settings for the PostgreSQL user store.
 *
 * <p>Bound from {@code app.store.*} inside the application, or built directly (for example with
 * {@link #fromEnvironment(Map)}) by tools that talk to the database without Spring. There are no
 * built-in defaults for host, port, database or credentials; {@link #requireComplete()} reports
 * every missing one at once.
 *
 * <p>Host fallback is opt-in: only when {@code allowFallback} is set does an unresolvable host
 * get replaced by {@code fallbackHost} (see {@link StoreHostResolver}).
 */
public class StoreProperties {

    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");

    private String host;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private String table = "metadata_manager_user";
    private boolean allowFallback = false;
    private String fallbackHost = "localhost";
    private int maxPoolSize = 10;
    private int minIdle = 2;

    /**
     * Reads the conventional {@code POSTGRES_*} variables from {@code env}:
     * {@code POSTGRES_HOST}, {@code POSTGRES_PORT}, {@code POSTGRES_DB}, {@code POSTGRES_USER},
     * {@code POSTGRES_PASSWORD} and {@code POSTGRES_ALLOW_LOCAL_FALLBACK}.
     * Absent variables are left unset.
     */
    public static StoreProperties fromEnvironment(Map<String, String> env) {
        StoreProperties props = new StoreProperties();
        props.setHost(env.get("POSTGRES_HOST"));
        String port = env.get("POSTGRES_PORT");
        if (port != null && !port.isBlank()) {
            try {
                props.setPort(Integer.valueOf(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("POSTGRES_PORT is not a number: " + port, e);
            }
        }
        props.setDatabase(env.get("POSTGRES_DB"));
        props.setUsername(env.get("POSTGRES_USER"));
        props.setPassword(env.get("POSTGRES_PASSWORD"));
        String fallback = env.getOrDefault("POSTGRES_ALLOW_LOCAL_FALLBACK", "");
        props.setAllowFallback(TRUTHY.contains(fallback.trim().toLowerCase(Locale.ROOT)));
        return props;
    }

    /**
     * Lists the required settings that are not set, in declaration order.
     */
    public List<String> missingSettings() {
        List<String> missing = new ArrayList<>();
        if (isBlank(host)) {
            missing.add("host");
        }
        if (port == null) {
            missing.add("port");
        }
        if (isBlank(database)) {
            missing.add("database");
        }
        if (isBlank(username)) {
            missing.add("username");
        }
        if (isBlank(password)) {
            missing.add("password");
        }
        return missing;
    }

    /**
     * @throws IllegalStateException naming every missing setting
     */
    public void requireComplete() {
        List<String> missing = missingSettings();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Store configuration missing: " + String.join(", ", missing)
                + ". Set app.store.* (or POSTGRES_* for standalone tools) or pass them explicitly.");
        }
    }

    public String jdbcUrl(String resolvedHost) {
        return "jdbc:postgresql://" + resolvedHost + ":" + port + "/" + database;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public Integer getPort() {
        return port;
    }

    public void setPort(Integer port) {
        this.port = port;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public boolean isAllowFallback() {
        return allowFallback;
    }

    public void setAllowFallback(boolean allowFallback) {
        this.allowFallback = allowFallback;
    }

    public String getFallbackHost() {
        return fallbackHost;
    }

    public void setFallbackHost(String fallbackHost) {
        this.fallbackHost = fallbackHost;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public int getMinIdle() {
        return minIdle;
    }

    public void setMinIdle(int minIdle) {
        this.minIdle = minIdle;
    }
}
