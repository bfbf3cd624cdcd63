package com.starscape.capture.common.domain;

import com.starscape.capture.common.exception.ValidationException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Construction-time checks shared by value objects. Every failure names the offending field.
 */
public final class Guard {

    private Guard() {
    }

    public static <T> T requireNonNull(String field, T value) {
        if (value == null) {
            throw new ValidationException(field, field + " is required");
        }
        return value;
    }

    public static String requireNonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " must be a non-empty string");
        }
        return value;
    }

    public static String requireMatches(String field, String value, Pattern pattern, String description) {
        requireNonBlank(field, value);
        if (!pattern.matcher(value).matches()) {
            throw new ValidationException(field, field + " must be " + description + ": " + value);
        }
        return value;
    }

    public static long requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new ValidationException(field, field + " cannot be negative");
        }
        return value;
    }

    public static double requireNonNegative(String field, double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new ValidationException(field, field + " cannot be negative");
        }
        return value;
    }

    public static long requirePositive(String field, long value) {
        if (value <= 0) {
            throw new ValidationException(field, field + " must be positive");
        }
        return value;
    }

    /**
     * Defensive copy of a list attribute; absent lists become empty, null elements are rejected.
     */
    public static <T> List<T> copyOf(String field, List<T> values) {
        if (values == null) {
            return List.of();
        }
        if (values.stream().anyMatch(v -> v == null)) {
            throw new ValidationException(field, field + " cannot contain null elements");
        }
        return List.copyOf(values);
    }
}
