package com.metadata.adapter.in.web;

import com.metadata.domain.model.User;

public record UserResponse(
    String id,
    String name,
    String phone,
    String address
) {
    public static UserResponse from(User user) {
        return new UserResponse(user.id().value(), user.name(), user.phone().value(), user.address());
    }
}
