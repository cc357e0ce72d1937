package com.ammann.nearmiss.exception;

/**
 * Exception indicating that a caller-supplied parameter does not meet the
 * constraints of the requested computation.
 *
 * <p>Always raised before any observation is fetched.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends KpiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for an empty or inverted time range.
     */
    public static ValidationException invalidRange(Object from, Object to) {
        return new ValidationException(
                String.format("Invalid time range: from '%s' must be before to '%s'", from, to));
    }
}
