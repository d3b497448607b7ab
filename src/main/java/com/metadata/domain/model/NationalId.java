package com.metadata.domain.model;

import com.metadata.domain.error.ValidationError.NationalIdError;
import com.metadata.domain.validation.IsraeliIdValidator;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Value Object for user identity: an Israeli national ID with a valid checksum.
 * The string is kept exactly as supplied (5-9 digits, no implicit zero padding).
 */
public record NationalId(String value) {

    public NationalId {
        // Compact constructor for internal use - assumes validated input
        if (value == null) {
            throw new IllegalStateException("NationalId value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses a string into a NationalId, returning a Result for expected validation failures.
     * Surrounding whitespace is ignored.
     */
    public static Result<NationalId, NationalIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(NationalIdError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        if (!IsraeliIdValidator.hasValidFormat(trimmed)) {
            return Result.failure(new NationalIdError.InvalidFormat(trimmed));
        }
        if (!IsraeliIdValidator.isValid(trimmed)) {
            return Result.failure(new NationalIdError.InvalidChecksum(trimmed));
        }
        return Result.success(new NationalId(trimmed));
    }

    /**
     * Creates a NationalId from a trusted source (e.g., the database).
     * For external/user input, use parse() instead.
     *
     * @throws IllegalStateException if the value fails validation (indicates data corruption)
     */
    public static NationalId fromTrusted(String value) {
        var result = parse(value);
        if (result.isFailure()) {
            throw new IllegalStateException("Corrupted NationalId in trusted source: " + value);
        }
        return result.getOrThrow();
    }

    /**
     * Creates a random valid 9-digit NationalId. Useful for tests and fixtures.
     */
    public static NationalId random() {
        return new NationalId(IsraeliIdValidator.generate(ThreadLocalRandom.current()));
    }

    @Override
    public String toString() {
        return value;
    }
}
