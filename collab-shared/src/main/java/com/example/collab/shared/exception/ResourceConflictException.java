package com.example.collab.shared.exception;

/**
 * Thrown when a resource with the same id already exists.
 */
public class ResourceConflictException extends CollabException {

    public ResourceConflictException(String message) {
        super(message);
    }
}
