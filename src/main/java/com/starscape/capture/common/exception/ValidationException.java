package com.starscape.capture.common.exception;

/**
 * Raised when a value object or raw capture payload violates its invariants.
 */
public class ValidationException extends IllegalArgumentException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
