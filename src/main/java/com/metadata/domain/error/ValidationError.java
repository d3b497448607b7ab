package com.metadata.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    /**
     * Name of the request field the error is about.
     */
    String field();

    // National ID validation errors
    sealed interface NationalIdError extends ValidationError {

        @Override
        default String field() {
            return "id";
        }

        record Empty() implements NationalIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "ID cannot be empty";
            }

            @Override
            public String code() {
                return "ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements NationalIdError {
            @Override
            public String message() {
                return "ID must be a string of 5-9 digits: " + value;
            }

            @Override
            public String code() {
                return "ID_INVALID_FORMAT";
            }
        }

        record InvalidChecksum(String value) implements NationalIdError {
            @Override
            public String message() {
                return "Invalid Israeli ID checksum: " + value;
            }

            @Override
            public String code() {
                return "ID_INVALID_CHECKSUM";
            }
        }
    }

    // Phone validation errors
    sealed interface PhoneError extends ValidationError {

        @Override
        default String field() {
            return "phone";
        }

        record Empty() implements PhoneError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "Phone number cannot be empty";
            }

            @Override
            public String code() {
                return "PHONE_EMPTY";
            }
        }

        record TooLong(int length, int maxLength) implements PhoneError {
            @Override
            public String message() {
                return "Phone number exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "PHONE_TOO_LONG";
            }
        }

        record Unparseable(String value) implements PhoneError {
            @Override
            public String message() {
                return "Phone number must be in valid international format (e.g., +972...): " + value;
            }

            @Override
            public String code() {
                return "PHONE_UNPARSEABLE";
            }
        }

        record NotValid(String value) implements PhoneError {
            @Override
            public String message() {
                return "Phone number is not valid: " + value;
            }

            @Override
            public String code() {
                return "PHONE_NOT_VALID";
            }
        }
    }

    // Plain string field errors (name, address, and shape problems on any field)
    sealed interface FieldError extends ValidationError {

        record Missing(String field) implements FieldError {
            @Override
            public String message() {
                return field + ": this field is required";
            }

            @Override
            public String code() {
                return "FIELD_REQUIRED";
            }
        }

        record Empty(String field) implements FieldError {
            @Override
            public String message() {
                return field + ": this field may not be blank";
            }

            @Override
            public String code() {
                return "FIELD_EMPTY";
            }
        }

        record TooLong(String field, int length, int maxLength) implements FieldError {
            @Override
            public String message() {
                return field + ": exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "FIELD_TOO_LONG";
            }
        }

        record InvalidType(String field, String actualType) implements FieldError {
            @Override
            public String message() {
                return field + ": expected a string but got " + actualType;
            }

            @Override
            public String code() {
                return "FIELD_INVALID_TYPE";
            }
        }
    }

    // Primary key immutability errors
    sealed interface IdMutationError extends ValidationError {

        @Override
        default String field() {
            return "id";
        }

        record IdChanged(String currentId, String requestedId) implements IdMutationError {
            @Override
            public String message() {
                return "Updating id is not allowed (" + currentId + " -> " + requestedId + ")";
            }

            @Override
            public String code() {
                return "ID_IMMUTABLE";
            }
        }

        record IdInPartialUpdate() implements IdMutationError {
            public static final IdInPartialUpdate INSTANCE = new IdInPartialUpdate();
            @Override
            public String message() {
                return "id may not be included in a partial update";
            }

            @Override
            public String code() {
                return "ID_NOT_ALLOWED";
            }
        }
    }

    // Request body shape errors
    sealed interface PayloadError extends ValidationError {

        record NotAnObject(String actualType) implements PayloadError {
            @Override
            public String message() {
                return "Request body must be a JSON object but was " + actualType;
            }

            @Override
            public String code() {
                return "PAYLOAD_NOT_OBJECT";
            }

            @Override
            public String field() {
                return null;
            }
        }
    }
}
