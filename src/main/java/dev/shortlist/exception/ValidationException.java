package dev.shortlist.exception;

/**
 * Raised when caller-supplied input (hints, limits, job parameters) is malformed.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
