package com.metadata.domain.model;

import com.metadata.domain.error.ValidationError;
import com.metadata.domain.error.ValidationError.FieldError;

/**
 * A user keyed by national ID. The id is fixed at creation; only name, phone and
 * address change afterwards.
 */
public record User(
    NationalId id,
    String name,
    PhoneNumber phone,
    String address
) {
    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_ADDRESS_LENGTH = 255;

    /**
     * Creates a User from raw input, returning the first validation failure in field order
     * (id, name, phone, address). {@code null} means the field was not supplied.
     */
    public static Result<User, ValidationError> create(String id, String name, String phone, String address) {
        var idResult = NationalId.parse(id);
        if (idResult.isFailure()) {
            return Result.failure(id == null ? new FieldError.Missing("id") : idResult.errorOrNull());
        }
        return validateFields(name, phone, address)
            .map(fields -> new User(idResult.getOrThrow(), fields.name(), fields.phone(), fields.address()));
    }

    /**
     * Returns a copy with name, phone and address replaced. All three are required.
     */
    public Result<User, ValidationError> replace(String newName, String newPhone, String newAddress) {
        return validateFields(newName, newPhone, newAddress)
            .map(fields -> new User(id, fields.name(), fields.phone(), fields.address()));
    }

    /**
     * Returns a copy with only the supplied fields changed. A {@code null} argument keeps the
     * current value.
     */
    public Result<User, ValidationError> patch(String newName, String newPhone, String newAddress) {
        String name = this.name;
        PhoneNumber phone = this.phone;
        String address = this.address;

        if (newName != null) {
            var nameResult = requireText("name", newName, MAX_NAME_LENGTH);
            if (nameResult.isFailure()) {
                return Result.failure(nameResult.errorOrNull());
            }
            name = nameResult.getOrThrow();
        }
        if (newPhone != null) {
            var phoneResult = PhoneNumber.parse(newPhone);
            if (phoneResult.isFailure()) {
                return Result.failure(phoneResult.errorOrNull());
            }
            phone = phoneResult.getOrThrow();
        }
        if (newAddress != null) {
            var addressResult = requireText("address", newAddress, MAX_ADDRESS_LENGTH);
            if (addressResult.isFailure()) {
                return Result.failure(addressResult.errorOrNull());
            }
            address = addressResult.getOrThrow();
        }
        return Result.success(new User(id, name, phone, address));
    }

    private static Result<Fields, ValidationError> validateFields(String name, String phone, String address) {
        var nameResult = requireText("name", name, MAX_NAME_LENGTH);
        if (nameResult.isFailure()) {
            return Result.failure(nameResult.errorOrNull());
        }
        if (phone == null) {
            return Result.failure(new FieldError.Missing("phone"));
        }
        var phoneResult = PhoneNumber.parse(phone);
        if (phoneResult.isFailure()) {
            return Result.failure(phoneResult.errorOrNull());
        }
        var addressResult = requireText("address", address, MAX_ADDRESS_LENGTH);
        if (addressResult.isFailure()) {
            return Result.failure(addressResult.errorOrNull());
        }
        return Result.success(new Fields(nameResult.getOrThrow(), phoneResult.getOrThrow(), addressResult.getOrThrow()));
    }

    private static Result<String, FieldError> requireText(String field, String value, int maxLength) {
        if (value == null) {
            return Result.failure(new FieldError.Missing(field));
        }
        if (value.isBlank()) {
            return Result.failure(new FieldError.Empty(field));
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            return Result.failure(new FieldError.TooLong(field, trimmed.length(), maxLength));
        }
        return Result.success(trimmed);
    }

    private record Fields(String name, PhoneNumber phone, String address) {}
}
