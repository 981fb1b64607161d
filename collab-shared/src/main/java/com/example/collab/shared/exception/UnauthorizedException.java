package com.example.collab.shared.exception;

/**
 * Thrown when the caller does not own the session or room.
 */
public class UnauthorizedException extends CollabException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
