package com.example.collab.shared.exception;

public class CacheReadException extends CollabException {

    public CacheReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
