package com.example.collab.shared.exception;

/**
 * Thrown when a room participant lacks the permission for an operation.
 */
public class InsufficientPermissionsException extends CollabException {

    public InsufficientPermissionsException(String message) {
        super(message);
    }
}
