package com.example.collab.shared.exception;

/**
 * Thrown when session, room or connection is absent.
 */
public class ResourceNotFoundException extends CollabException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
