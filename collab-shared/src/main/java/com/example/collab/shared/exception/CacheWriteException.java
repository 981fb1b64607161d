package com.example.collab.shared.exception;

/**
 * The remote cache tier rejected or failed a write.
 */
public class CacheWriteException extends CollabException {

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
