package com.example.collab.shared.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Single-node remote tier for local development and tests. Entries are held as JSON so readers
 * never share mutable state with writers, matching the Redis backend.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "collab.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCacheBackend implements CacheBackend {

    private final Map<String, StoredValue> entries = new ConcurrentHashMap<>();
    private final Map<String, TagSet> tagIndex = new ConcurrentHashMap<>();
    private final Map<String, LockLease> locks = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryCacheBackend(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> read(String namespace, String key) {
        String storageKey = storageKey(namespace, key);
        StoredValue stored = entries.get(storageKey);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.expiresAtMs != null && stored.expiresAtMs <= clock.millis()) {
            entries.remove(storageKey, stored);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(stored.json, CacheEntry.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cache entry " + storageKey, e);
        }
    }

    @Override
    public void write(CacheEntry entry, Duration retention) {
        try {
            Long expiresAt = retention == null ? null : clock.millis() + retention.toMillis();
            entries.put(storageKey(entry.getNamespace(), entry.getKey()),
                    new StoredValue(objectMapper.writeValueAsString(entry), expiresAt));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for " + entry.getKey() + " is not serializable", e);
        }
    }

    @Override
    public boolean remove(String namespace, String key) {
        return entries.remove(storageKey(namespace, key)) != null;
    }

    @Override
    public Set<String> keys(String namespace) {
        String prefix = namespace + ":";
        long now = clock.millis();
        return entries.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .filter(e -> e.getValue().expiresAtMs == null || e.getValue().expiresAtMs > now)
                .map(e -> e.getKey().substring(prefix.length()))
                .collect(Collectors.toSet());
    }

    @Override
    public void tag(String namespace, String tag, String key, Duration retention) {
        Long expiresAt = retention == null ? null : clock.millis() + retention.toMillis();
        tagIndex.compute(tagKey(namespace, tag), (k, existing) -> {
            TagSet tagSet = existing == null || existing.isExpired(clock.millis()) ? new TagSet() : existing;
            tagSet.members.add(key);
            tagSet.extendTo(expiresAt);
            return tagSet;
        });
    }

    @Override
    public void untag(String namespace, String tag, String key) {
        tagIndex.computeIfPresent(tagKey(namespace, tag), (k, existing) -> {
            existing.members.remove(key);
            return existing.members.isEmpty() ? null : existing;
        });
    }

    @Override
    public Set<String> taggedKeys(String namespace, String tag) {
        String tagKey = tagKey(namespace, tag);
        TagSet tagSet = tagIndex.get(tagKey);
        if (tagSet == null) {
            return Set.of();
        }
        long now = clock.millis();
        if (tagSet.isExpired(now)) {
            tagIndex.remove(tagKey, tagSet);
            return Set.of();
        }
        tagSet.members.removeIf(key -> !isLive(storageKey(namespace, key), now));
        if (tagSet.members.isEmpty()) {
            tagIndex.remove(tagKey, tagSet);
            return Set.of();
        }
        return Set.copyOf(tagSet.members);
    }

    @Override
    public void dropTag(String namespace, String tag) {
        tagIndex.remove(tagKey(namespace, tag));
    }

    @Override
    public boolean tryLock(String lockKey, String owner, Duration lease) {
        long now = clock.millis();
        LockLease candidate = new LockLease(owner, now + lease.toMillis());
        LockLease current = locks.compute(lockKey, (k, existing) ->
                existing == null || existing.expiresAtMs <= now ? candidate : existing);
        return current == candidate;
    }

    @Override
    public void unlock(String lockKey, String owner) {
        locks.computeIfPresent(lockKey, (k, existing) -> existing.owner.equals(owner) ? null : existing);
    }

    /**
     * Drops physically expired entries, expired tag sets and tag members whose entry is gone.
     *
     * @return number of entries and tag sets removed
     */
    @Scheduled(fixedDelayString = "${collab.cache.sweep-interval-ms:60000}")
    public int sweepExpired() {
        long now = clock.millis();
        int before = entries.size() + tagIndex.size();
        entries.entrySet().removeIf(e -> e.getValue().expiresAtMs != null && e.getValue().expiresAtMs <= now);
        tagIndex.entrySet().removeIf(e -> {
            TagSet tagSet = e.getValue();
            if (tagSet.isExpired(now)) {
                return true;
            }
            String namespace = e.getKey().substring(0, e.getKey().indexOf(':'));
            tagSet.members.removeIf(key -> !isLive(storageKey(namespace, key), now));
            return tagSet.members.isEmpty();
        });
        int removed = before - entries.size() - tagIndex.size();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries and tag sets", removed);
        }
        return removed;
    }

    private boolean isLive(String storageKey, long now) {
        StoredValue stored = entries.get(storageKey);
        return stored != null && (stored.expiresAtMs == null || stored.expiresAtMs > now);
    }

    private static String storageKey(String namespace, String key) {
        return namespace + ":" + key;
    }

    private static String tagKey(String namespace, String tag) {
        return namespace + ":" + tag;
    }

    @AllArgsConstructor
    private static class StoredValue {
        private final String json;
        private final Long expiresAtMs;
    }

    private static class TagSet {
        private final Set<String> members = ConcurrentHashMap.newKeySet();
        private volatile Long expiresAtMs = Long.MIN_VALUE;

        // null means the set outlives every member
        void extendTo(Long candidate) {
            if (candidate == null) {
                expiresAtMs = null;
            } else if (expiresAtMs != null && candidate > expiresAtMs) {
                expiresAtMs = candidate;
            }
        }

        boolean isExpired(long now) {
            return expiresAtMs != null && expiresAtMs <= now;
        }
    }

    @AllArgsConstructor
    private static class LockLease {
        private final String owner;
        private final long expiresAtMs;
    }
}
