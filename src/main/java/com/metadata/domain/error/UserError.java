package com.metadata.domain.error;

/**
 * Sealed type representing expected business errors for user operations at the application layer.
 * Existence errors are determined by querying the store, not by domain validation.
 *
 * For field-level problems, see {@link ValidationError}.
 */
public sealed interface UserError {

    record AlreadyExists(String id) implements UserError {
        @Override
        public String message() {
            return "User with id " + id + " already exists";
        }

        @Override
        public String code() {
            return "USER_ALREADY_EXISTS";
        }
    }

    record NotFound(String id) implements UserError {
        @Override
        public String message() {
            return "User not found: " + id;
        }

        @Override
        public String code() {
            return "USER_NOT_FOUND";
        }
    }

    /**
     * Wraps a domain validation error raised while checking a request.
     */
    record ValidationFailed(ValidationError error) implements UserError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
