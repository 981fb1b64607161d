package com.example.collab.shared.cache;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-namespace cache with tag invalidation, stale-while-revalidate reads and a best-effort
 * single-flight lock around loads.
 */
public interface CacheService {

    <T> Optional<T> get(String namespace, String key, Class<T> type);

    /**
     * Overwrites unconditionally.
     *
     * @throws com.example.collab.shared.exception.CacheWriteException if the remote tier fails
     */
    void set(String namespace, String key, Object value, CacheOptions options);

    /**
     * @return false if the key was absent
     */
    boolean delete(String namespace, String key);

    /**
     * Removes every entry matching any of the supplied criteria.
     *
     * @return number of entries removed
     */
    int invalidate(InvalidationCriteria criteria);

    <T> T getOrSet(String namespace, String key, Class<T> type, ValueLoader<T> loader, CacheOptions options);

    /**
     * Seeds missing keys in descending priority order. When {@code repeatEvery} is set the warmup is
     * rescheduled at that rate until shutdown.
     */
    WarmupResult warmup(List<WarmupEntry<?>> entries, Duration repeatEvery);

    CacheHealth healthCheck();

    Set<String> namespaces();

    Map<String, Map<String, Object>> getStats();
}
