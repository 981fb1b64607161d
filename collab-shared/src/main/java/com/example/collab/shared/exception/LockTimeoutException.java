package com.example.collab.shared.exception;

/**
 * Work queued behind a per-key lock did not complete within the allowed time.
 */
public class LockTimeoutException extends CollabException {

    public LockTimeoutException(String message) {
        super(message);
    }
}
