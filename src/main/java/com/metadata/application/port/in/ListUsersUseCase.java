package com.metadata.application.port.in;

import com.metadata.domain.model.NationalId;
import com.metadata.domain.model.User;

import java.util.List;

public interface ListUsersUseCase {

    /**
     * Returns every user in primary-key order.
     */
    List<User> listUsers();

    /**
     * Returns every user id in primary-key order.
     */
    List<NationalId> listUserIds();
}
