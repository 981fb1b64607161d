package com.example.collab.shared.exception;

import lombok.Getter;

@Getter
public class RateLimitedException extends CollabException {

    private final long retryAfterMs;

    public RateLimitedException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }
}
