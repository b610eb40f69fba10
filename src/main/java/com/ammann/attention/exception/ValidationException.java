/* (C)2026 */
package com.ammann.attention.exception;

/**
 * A client-supplied parameter or payload does not meet the constraints of the requested
 * operation. Mapped to HTTP 400 by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ValidationException invalidParameter(
            String paramName, Object value, String expected) {
        return new ValidationException(
                String.format(
                        "Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    public static ValidationException missingParameter(String paramName) {
        return new ValidationException(
                String.format("Missing required parameter '%s'", paramName));
    }
}
