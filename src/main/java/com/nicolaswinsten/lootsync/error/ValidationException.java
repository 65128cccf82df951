package com.nicolaswinsten.lootsync.error;

/** A required field is missing or empty, or an update carried nothing to apply. */
public class ValidationException extends WorldStateException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    /** Throws when {@code value} is null or blank, otherwise returns it trimmed. */
    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + field);
        }
        return value.trim();
    }

    /** Throws when {@code value} is null or blank, otherwise returns it exactly as given. */
    public static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + field);
        }
        return value;
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new ValidationException("Missing required field: " + field);
        }
        return value;
    }
}
