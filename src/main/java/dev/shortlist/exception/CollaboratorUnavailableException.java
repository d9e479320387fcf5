package dev.shortlist.exception;

/**
 * Raised when an external collaborator (document store, retrieval index,
 * answer provider) cannot serve a request.
 */
public class CollaboratorUnavailableException extends RuntimeException {

    public CollaboratorUnavailableException(String message) {
        super(message);
    }

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
