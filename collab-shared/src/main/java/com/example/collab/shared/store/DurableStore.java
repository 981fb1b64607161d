package com.example.collab.shared.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Durable key-value storage for coordinator state. Values are JSON documents.
 * Failures surface as {@link com.example.collab.shared.exception.StorageException}.
 */
public interface DurableStore {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value);

    void put(String key, Object value, Duration ttl);

    boolean delete(String key);

    Set<String> keys(String prefix);

    /**
     * One-shot alarm: the last value set wins, cleared with {@link #deleteAlarm(String)}.
     */
    Optional<Instant> getAlarm(String name);

    void setAlarm(String name, Instant fireAt);

    void deleteAlarm(String name);
}
