package com.metadata.domain.model;

import com.metadata.domain.error.ValidationError.PhoneError;
import com.metadata.domain.validation.PhoneNumberValidator;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Value Object for an international phone number, stored as the caller wrote it (trimmed).
 */
public record PhoneNumber(String value) {

    public static final int MAX_LENGTH = 20;

    public PhoneNumber {
        if (value == null) {
            throw new IllegalStateException("PhoneNumber value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses a string into a PhoneNumber, returning a Result for expected validation failures.
     */
    public static Result<PhoneNumber, PhoneError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(PhoneError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            return Result.failure(new PhoneError.TooLong(trimmed.length(), MAX_LENGTH));
        }
        var parsed = PhoneNumberValidator.tryParse(trimmed);
        if (parsed.isEmpty()) {
            return Result.failure(new PhoneError.Unparseable(trimmed));
        }
        if (!PhoneNumberValidator.isValid(parsed.get())) {
            return Result.failure(new PhoneError.NotValid(trimmed));
        }
        return Result.success(new PhoneNumber(trimmed));
    }

    /**
     * Wraps a value read back from the store without re-validating it.
     */
    public static PhoneNumber fromTrusted(String value) {
        return new PhoneNumber(value);
    }

    /**
     * Creates a random valid Israeli phone number. Useful for tests and fixtures.
     */
    public static PhoneNumber random() {
        return new PhoneNumber(PhoneNumberValidator.generateIsraeli(ThreadLocalRandom.current()));
    }

    @Override
    public String toString() {
        return value;
    }
}
