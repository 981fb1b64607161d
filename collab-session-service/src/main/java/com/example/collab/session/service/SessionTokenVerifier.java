package com.example.collab.session.service;

import com.example.collab.session.model.SessionToken;
import com.example.collab.shared.store.DurableStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Checks upgrade tokens against the records the auth service writes to the durable store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionTokenVerifier {

    private final DurableStore store;
    private final Clock clock;

    public Optional<SessionToken> verify(String token, String sessionId) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<SessionToken> record = store.get("token:" + token, SessionToken.class);
        if (record.isEmpty()) {
            log.debug("Unknown token presented for session {}", sessionId);
            return Optional.empty();
        }
        SessionToken sessionToken = record.get();
        if (!sessionId.equals(sessionToken.getSessionId()) || sessionToken.getExpiresAt() <= clock.millis()) {
            log.warn("Token rejected for session {}: bound to {} expiring at {}", sessionId,
                    sessionToken.getSessionId(), sessionToken.getExpiresAt());
            return Optional.empty();
        }
        return record;
    }
}
