package com.metadata.application.port.out;

import com.metadata.domain.model.NationalId;
import com.metadata.domain.model.User;

import java.util.List;
import java.util.Optional;

/**
 * Port for the user table. Every method touches at most one row, except the bulk reads.
 */
public interface UserRepository {

    /**
     * Inserts the user unless the id is taken.
     *
     * @return false if a user with the same id already exists
     */
    boolean insert(User user);

    Optional<User> findById(NationalId id);

    /**
     * Reads the row and holds a write lock on it until the surrounding transaction ends.
     */
    Optional<User> findByIdForUpdate(NationalId id);

    List<User> findAll();

    List<NationalId> findAllIds();

    /**
     * Overwrites name, phone and address of an existing row.
     *
     * @return false if no row has that id
     */
    boolean update(User user);

    /**
     * @return false if no row has that id
     */
    boolean delete(NationalId id);
}
