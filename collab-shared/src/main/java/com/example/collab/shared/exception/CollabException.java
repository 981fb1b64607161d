package com.example.collab.shared.exception;

/**
 * Base type for failures that map to a well-defined client-visible outcome.
 */
public abstract class CollabException extends RuntimeException {

    protected CollabException(String message) {
        super(message);
    }

    protected CollabException(String message, Throwable cause) {
        super(message, cause);
    }
}
