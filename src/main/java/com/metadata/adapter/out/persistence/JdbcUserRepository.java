package com.metadata.adapter.out.persistence;

import com.metadata.application.port.out.UserRepository;
import com.metadata.domain.model.NationalId;
import com.metadata.domain.model.PhoneNumber;
import com.metadata.domain.model.User;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> new User(
        NationalId.fromTrusted(rs.getString("id")),
        rs.getString("name"),
        PhoneNumber.fromTrusted(rs.getString("phone")),
        rs.getString("address")
    );

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean insert(User user) {
        int inserted = jdbc.update("""
            INSERT INTO metadata_manager_user (id, name, phone, address)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """,
            user.id().value(),
            user.name(),
            user.phone().value(),
            user.address()
        );
        return inserted > 0;
    }

    @Override
    public Optional<User> findById(NationalId id) {
        return jdbc.query(
            "SELECT id, name, phone, address FROM metadata_manager_user WHERE id = ?",
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public Optional<User> findByIdForUpdate(NationalId id) {
        return jdbc.query(
            "SELECT id, name, phone, address FROM metadata_manager_user WHERE id = ? FOR UPDATE",
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public List<User> findAll() {
        return jdbc.query(
            "SELECT id, name, phone, address FROM metadata_manager_user ORDER BY id",
            ROW_MAPPER
        );
    }

    @Override
    public List<NationalId> findAllIds() {
        return jdbc.query(
            "SELECT id FROM metadata_manager_user ORDER BY id",
            (rs, rowNum) -> NationalId.fromTrusted(rs.getString("id"))
        );
    }

    @Override
    public boolean update(User user) {
        int updated = jdbc.update("""
            UPDATE metadata_manager_user
            SET name = ?, phone = ?, address = ?
            WHERE id = ?
            """,
            user.name(),
            user.phone().value(),
            user.address(),
            user.id().value()
        );
        return updated > 0;
    }

    @Override
    public boolean delete(NationalId id) {
        return jdbc.update("DELETE FROM metadata_manager_user WHERE id = ?", id.value()) > 0;
    }
}
