package com.metadata.client;

/**
 * Wire representation of a user as sent to and returned by {@code /api/users/}.
 */
public record UserBody(String id, String name, String phone, String address) {}
