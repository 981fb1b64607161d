package com.example.collab.session.service;

import com.example.collab.session.model.SessionEvent;
import com.example.collab.shared.store.DurableStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Append-only lifecycle and analytics log kept in the durable store under {@code event:<ms>:<suffix>}.
 * Logging never fails the caller.
 */
@Service
@Slf4j
public class SessionEventLog {

    static final String PREFIX = "event:";
    private static final Duration RETENTION = Duration.ofDays(30);
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final DurableStore store;
    private final Clock clock;

    public SessionEventLog(DurableStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void append(SessionEvent event) {
        if (event.getTimestamp() == 0) {
            event.setTimestamp(clock.millis());
        }
        String key = PREFIX + event.getTimestamp() + ":" + randomSuffix();
        try {
            store.put(key, event, RETENTION);
        } catch (RuntimeException e) {
            log.warn("Failed to log {} event for session {}: {}", event.getType(), event.getSessionId(), e.getMessage());
        }
    }

    /**
     * Room lifecycle events for one room, oldest first.
     */
    public List<SessionEvent> roomHistory(String roomId) {
        return store.keys(PREFIX).stream()
                .map(key -> store.get(key, SessionEvent.class))
                .flatMap(Optional::stream)
                .filter(e -> roomId.equals(e.getRoomId()) && e.getType() != null && e.getType().isRoomLifecycle())
                .sorted(Comparator.comparingLong(SessionEvent::getTimestamp))
                .collect(Collectors.toList());
    }

    private static String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            sb.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return sb.toString();
    }
}
