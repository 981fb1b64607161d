package com.example.collab.shared.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Remote (shared) cache tier. Implementations report I/O failures as unchecked exceptions;
 * the caller decides whether a failure is fatal.
 */
public interface CacheBackend {

    /**
     * Returns the stored entry even if it is logically expired.
     */
    Optional<CacheEntry> read(String namespace, String key);

    /**
     * @param retention how long the backend keeps the entry physically, null for no expiry
     */
    void write(CacheEntry entry, Duration retention);

    boolean remove(String namespace, String key);

    Set<String> keys(String namespace);

    /**
     * Adds {@code key} to the tag set. The set itself is kept at least as long as {@code retention}.
     */
    void tag(String namespace, String tag, String key, Duration retention);

    void untag(String namespace, String tag, String key);

    /**
     * Members of the tag set whose entries still exist. Members without an entry are pruned.
     */
    Set<String> taggedKeys(String namespace, String tag);

    void dropTag(String namespace, String tag);

    /**
     * Set-if-absent with a lease.
     */
    boolean tryLock(String lockKey, String owner, Duration lease);

    void unlock(String lockKey, String owner);
}
