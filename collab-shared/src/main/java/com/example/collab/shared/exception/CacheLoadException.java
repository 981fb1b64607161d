package com.example.collab.shared.exception;

/**
 * A loader passed to {@code getOrSet} failed and no stale value could be served in its place.
 */
public class CacheLoadException extends CollabException {

    public CacheLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
