package com.metadata.client.db;

import com.metadata.infrastructure.store.StoreHostResolver;
import com.metadata.infrastructure.store.StoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Direct access to the user table, bypassing the HTTP API. Meant for test assertions and
 * cleanup. Opens a fresh connection per call.
 */
public class UserTableClient {

    private static final Logger log = LoggerFactory.getLogger(UserTableClient.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final RowMapper<UserRow> ROW_MAPPER = (rs, rowNum) -> new UserRow(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("phone"),
        rs.getString("address")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final String table;

    public UserTableClient(StoreProperties props) {
        this(props, new StoreHostResolver());
    }

    /**
     * @throws IllegalStateException if any connection setting is missing
     * @throws IllegalArgumentException if the table name is not a plain SQL identifier
     */
    public UserTableClient(StoreProperties props, StoreHostResolver hostResolver) {
        props.requireComplete();
        if (props.getTable() == null || !IDENTIFIER.matcher(props.getTable()).matches()) {
            throw new IllegalArgumentException("Not a valid table name: " + props.getTable());
        }
        String host = hostResolver.resolve(props);
        this.jdbc = new NamedParameterJdbcTemplate(
            new DriverManagerDataSource(props.jdbcUrl(host), props.getUsername(), props.getPassword()));
        this.table = props.getTable();
        log.debug("User table client for {} at {}:{}", table, host, props.getPort());
    }

    public Optional<UserRow> findById(String id) {
        return jdbc.query(
            "SELECT id, name, phone, address FROM " + table + " WHERE id = :id",
            new MapSqlParameterSource("id", id),
            ROW_MAPPER
        ).stream().findFirst();
    }

    /**
     * Returns true if every id has a row. An empty collection trivially exists.
     */
    public boolean allExist(Collection<String> ids) {
        Set<String> distinct = new LinkedHashSet<>(ids);
        if (distinct.isEmpty()) {
            return true;
        }
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", distinct),
            Long.class
        );
        return count != null && count == distinct.size();
    }

    /**
     * @return number of rows removed
     */
    public int deleteByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        int deleted = jdbc.update(
            "DELETE FROM " + table + " WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", new LinkedHashSet<>(ids))
        );
        log.debug("Deleted {} rows from {}", deleted, table);
        return deleted;
    }

    public record UserRow(String id, String name, String phone, String address) {}
}
