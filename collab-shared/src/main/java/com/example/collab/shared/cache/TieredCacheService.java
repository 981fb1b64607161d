package com.example.collab.shared.cache;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.config.MonitoringConfig;
import com.example.collab.shared.exception.CacheLoadException;
import com.example.collab.shared.exception.CacheWriteException;
import com.example.collab.shared.exception.UnknownNamespaceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.regex.Pattern;

/**
 * Two-tier cache: an optional Caffeine tier in this process in front of a shared {@link CacheBackend}.
 * Freshness is always decided from the entry's own timestamp and TTL, so disabling the local tier
 * changes latency only.
 */
@Service
@Slf4j
public class TieredCacheService implements CacheService {

    private static final Duration HEALTH_CHECK_TTL = Duration.ofSeconds(60);

    private final CacheBackend remote;
    private final Cache<String, CacheEntry> localTier;
    private final ObjectMapper objectMapper;
    private final AppProperties.Cache settings;
    private final TaskScheduler taskScheduler;
    private final MonitoringConfig.CollabMetricsCollector metricsCollector;
    private final Clock clock;

    private final Map<String, NamespaceStats> stats = new LinkedHashMap<>();
    private final List<ScheduledFuture<?>> warmupSchedules = new CopyOnWriteArrayList<>();

    public TieredCacheService(CacheBackend remote,
                              Cache<String, CacheEntry> localCacheTier,
                              ObjectMapper objectMapper,
                              AppProperties appProperties,
                              TaskScheduler taskScheduler,
                              MonitoringConfig.CollabMetricsCollector metricsCollector,
                              Clock clock) {
        this.remote = remote;
        this.settings = appProperties.getCache();
        this.localTier = settings.isLocalTierEnabled() ? localCacheTier : null;
        this.objectMapper = objectMapper;
        this.taskScheduler = taskScheduler;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
        settings.getNamespaces().keySet().forEach(ns -> stats.put(ns, new NamespaceStats()));
        log.info("Cache initialised with namespaces {} (local tier {})", stats.keySet(), localTier != null ? "enabled" : "disabled");
    }

    @PreDestroy
    public void shutdown() {
        warmupSchedules.forEach(schedule -> schedule.cancel(false));
        warmupSchedules.clear();
    }

    @Override
    public <T> Optional<T> get(String namespace, String key, Class<T> type) {
        NamespaceStats nsStats = requireNamespace(namespace);
        long start = System.nanoTime();
        Lookup found = lookup(namespace, key, true);
        nsStats.readTimeMs.add(elapsedMs(start));

        Optional<T> value = found.fresh == null ? Optional.empty() : convert(found.fresh, type);
        recordRead(namespace, nsStats, value.isPresent());
        return value;
    }

    @Override
    public void set(String namespace, String key, Object value, CacheOptions options) {
        AppProperties.Cache.Namespace nsSettings = requireSettings(namespace);
        NamespaceStats nsStats = stats.get(namespace);
        CacheOptions opts = options != null ? options : CacheOptions.defaults();

        Duration ttl = effectiveTtl(nsSettings, opts.getTtl());
        long now = clock.millis();
        CacheEntry entry = CacheEntry.builder()
                .namespace(namespace)
                .key(key)
                .data(objectMapper.valueToTree(value))
                .timestamp(now)
                .ttlSeconds(ttl.getSeconds())
                .tags(opts.getTags() != null ? new HashSet<>(opts.getTags()) : new HashSet<>())
                .lastAccessedAt(now)
                .version(opts.getVersion() != null ? opts.getVersion() : 1L)
                .build();

        Duration retention = ttl.plus(settings.getStaleGrace());
        long start = System.nanoTime();
        try {
            CacheEntry previous = remote.read(namespace, key).orElse(null);
            remote.write(entry, retention);
            for (String tag : entry.getTags()) {
                remote.tag(namespace, tag, key, retention);
            }
            if (previous != null) {
                for (String tag : previous.getTags()) {
                    if (!entry.getTags().contains(tag)) {
                        remote.untag(namespace, tag, key);
                    }
                }
            }
        } catch (RuntimeException e) {
            nsStats.writeErrors.increment();
            metricsCollector.incrementCounter("collab.errors", "type", "cache");
            invalidateLocal(namespace, key);
            throw new CacheWriteException("Failed to write cache entry " + namespace + ":" + key, e);
        } finally {
            long took = elapsedMs(start);
            nsStats.writeTimeMs.add(took);
            metricsCollector.recordTimer("collab.cache.latency", took, "operation", "write");
        }

        if (localTier != null) {
            localTier.put(localKey(namespace, key), entry);
        }
        nsStats.sets.increment();
    }

    @Override
    public boolean delete(String namespace, String key) {
        NamespaceStats nsStats = requireNamespace(namespace);
        CacheEntry local = evictLocal(namespace, key);
        boolean hadLocal = local != null;
        boolean removed;
        try {
            removed = removeEntry(namespace, key, local);
        } catch (RuntimeException e) {
            nsStats.writeErrors.increment();
            throw new CacheWriteException("Failed to delete cache entry " + namespace + ":" + key, e);
        }
        if (removed || hadLocal) {
            nsStats.deletes.increment();
        }
        return removed || hadLocal;
    }

    @Override
    public int invalidate(InvalidationCriteria criteria) {
        if (criteria == null || criteria.isEmpty()) {
            return 0;
        }
        List<String> targets = new ArrayList<>();
        if (criteria.getNamespace() != null) {
            requireNamespace(criteria.getNamespace());
            targets.add(criteria.getNamespace());
        } else {
            targets.addAll(stats.keySet());
        }

        int removed = 0;
        for (String namespace : targets) {
            try {
                removed += invalidateNamespace(namespace, criteria);
            } catch (RuntimeException e) {
                stats.get(namespace).writeErrors.increment();
                throw new CacheWriteException("Invalidation failed in namespace " + namespace, e);
            }
        }
        if (removed > 0) {
            log.debug("Invalidated {} cache entries (tags={}, pattern={}, olderThan={}, namespace={})",
                    removed, criteria.getTags(), criteria.getPattern(), criteria.getOlderThan(), criteria.getNamespace());
        }
        return removed;
    }

    private int invalidateNamespace(String namespace, InvalidationCriteria criteria) {
        Set<String> matched = new HashSet<>();
        if (criteria.getTags() != null) {
            for (String tag : criteria.getTags()) {
                for (String key : remote.taggedKeys(namespace, tag)) {
                    if (carriesTag(namespace, key, tag)) {
                        matched.add(key);
                    } else {
                        remote.untag(namespace, tag, key);
                    }
                }
            }
        }
        boolean byPattern = criteria.getPattern() != null && !criteria.getPattern().isEmpty();
        if (byPattern || criteria.getOlderThan() != null) {
            Set<String> candidates = new HashSet<>(remote.keys(namespace));
            candidates.addAll(localKeys(namespace));
            Pattern glob = byPattern ? globToRegex(criteria.getPattern()) : null;
            long cutoff = criteria.getOlderThan() != null ? criteria.getOlderThan().toEpochMilli() : Long.MIN_VALUE;
            for (String key : candidates) {
                if (glob != null && glob.matcher(key).matches()) {
                    matched.add(key);
                } else if (criteria.getOlderThan() != null && isOlderThan(namespace, key, cutoff)) {
                    matched.add(key);
                }
            }
        }

        int removed = 0;
        for (String key : matched) {
            CacheEntry local = evictLocal(namespace, key);
            if (removeEntry(namespace, key, local) || local != null) {
                removed++;
            }
        }
        if (criteria.getTags() != null) {
            criteria.getTags().forEach(tag -> remote.dropTag(namespace, tag));
        }
        stats.get(namespace).deletes.add(removed);
        return removed;
    }

    @Override
    public <T> T getOrSet(String namespace, String key, Class<T> type, ValueLoader<T> loader, CacheOptions options) {
        NamespaceStats nsStats = requireNamespace(namespace);
        CacheOptions opts = options != null ? options : CacheOptions.defaults();

        Lookup found = lookup(namespace, key, false);
        Optional<T> cached = found.fresh == null ? Optional.empty() : convert(found.fresh, type);
        recordRead(namespace, nsStats, cached.isPresent());
        if (cached.isPresent()) {
            return cached.get();
        }
        CacheEntry stale = found.stale;

        String lockKey = namespace + ":" + key;
        String owner = UUID.randomUUID().toString();
        Duration lease = opts.getLockTimeout() != null ? opts.getLockTimeout() : settings.getLockTimeout();
        boolean locked = tryLock(lockKey, owner, lease);
        try {
            if (!locked) {
                // Someone else is loading this key. Back off once, re-read, then load anyway.
                // Two loads under contention are possible; overwriting a newer value with an older one is not.
                pause(min(settings.getLockBackoff(), lease));
                Lookup retry = lookup(namespace, key, false);
                if (retry.fresh != null) {
                    Optional<T> loaded = convert(retry.fresh, type);
                    if (loaded.isPresent()) {
                        return loaded.get();
                    }
                }
                if (retry.stale != null) {
                    stale = retry.stale;
                }
            }

            T value;
            try {
                value = loader.load();
            } catch (Exception e) {
                if (opts.isStaleWhileRevalidate() && stale != null) {
                    Optional<T> staleValue = convert(stale, type);
                    if (staleValue.isPresent()) {
                        log.warn("Loader for {}:{} failed, serving stale value from {}: {}", namespace, key, stale.getTimestamp(), e.getMessage());
                        return staleValue.get();
                    }
                }
                if (e instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new CacheLoadException("Failed to load " + namespace + ":" + key, e);
            }

            try {
                set(namespace, key, value, opts);
            } catch (CacheWriteException e) {
                log.warn("Loaded {}:{} but could not cache it: {}", namespace, key, e.getMessage());
            }
            return value;
        } finally {
            if (locked) {
                releaseLock(lockKey, owner);
            }
        }
    }

    @Override
    public WarmupResult warmup(List<WarmupEntry<?>> entries, Duration repeatEvery) {
        entries.forEach(entry -> requireNamespace(entry.getNamespace()));
        List<WarmupEntry<?>> ordered = new ArrayList<>(entries);
        ordered.sort((a, b) -> Integer.compare(b.getPriority(), a.getPriority()));

        int success = 0;
        int skipped = 0;
        int failed = 0;
        for (WarmupEntry<?> entry : ordered) {
            if (lookup(entry.getNamespace(), entry.getKey(), false).fresh != null) {
                skipped++;
                continue;
            }
            try {
                Object value = entry.getLoader().load();
                set(entry.getNamespace(), entry.getKey(), value, entry.getOptions());
                success++;
            } catch (Exception e) {
                failed++;
                log.warn("Warmup failed for {}:{}: {}", entry.getNamespace(), entry.getKey(), e.getMessage());
            }
        }

        if (repeatEvery != null) {
            ScheduledFuture<?> schedule = taskScheduler.scheduleAtFixedRate(
                    () -> warmup(ordered, null), clock.instant().plus(repeatEvery), repeatEvery);
            warmupSchedules.add(schedule);
        }
        log.info("Cache warmup finished: {} loaded, {} already fresh, {} failed", success, skipped, failed);
        return new WarmupResult(success, skipped, failed);
    }

    @Override
    public CacheHealth healthCheck() {
        long start = System.nanoTime();
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            for (String namespace : stats.keySet()) {
                String key = "health-check-" + clock.millis();
                set(namespace, key, Map.of("ok", true), CacheOptions.ttl(HEALTH_CHECK_TTL));
                boolean readBack = remote.read(namespace, key).isPresent();
                delete(namespace, key);
                if (!readBack) {
                    throw new IllegalStateException("Health check entry was not readable in namespace " + namespace);
                }
                details.put(namespace, "ok");
            }
            long took = elapsedMs(start);
            CacheHealth.Status status = took > settings.getDegradedThreshold().toMillis()
                    ? CacheHealth.Status.DEGRADED
                    : CacheHealth.Status.HEALTHY;
            return CacheHealth.builder().status(status).responseTimeMs(took).details(details).build();
        } catch (Exception e) {
            log.error("Cache health check failed: {}", e.getMessage());
            return CacheHealth.builder()
                    .status(CacheHealth.Status.UNHEALTHY)
                    .responseTimeMs(elapsedMs(start))
                    .error(e.getMessage())
                    .details(details)
                    .build();
        }
    }

    @Override
    public Set<String> namespaces() {
        return stats.keySet();
    }

    @Override
    public Map<String, Map<String, Object>> getStats() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        stats.forEach((namespace, nsStats) -> result.put(namespace, nsStats.snapshot()));
        if (localTier != null) {
            CacheStats local = localTier.stats();
            Map<String, Object> localStats = new LinkedHashMap<>();
            localStats.put("size", localTier.estimatedSize());
            localStats.put("hitRate", local.hitRate());
            localStats.put("evictions", local.evictionCount());
            result.put("localTier", localStats);
        }
        return result;
    }

    private Lookup lookup(String namespace, String key, boolean evictExpired) {
        long now = clock.millis();
        CacheEntry stale = null;
        if (localTier != null) {
            CacheEntry local = localTier.getIfPresent(localKey(namespace, key));
            if (local != null) {
                if (!local.isExpired(now)) {
                    local.recordAccess(now);
                    return new Lookup(local, null);
                }
                stale = local;
                localTier.invalidate(localKey(namespace, key));
            }
        }

        CacheEntry stored;
        long start = System.nanoTime();
        try {
            stored = remote.read(namespace, key).orElse(null);
        } catch (RuntimeException e) {
            stats.get(namespace).readErrors.increment();
            metricsCollector.incrementCounter("collab.errors", "type", "cache");
            log.warn("Cache read failed for {}:{}, treating as miss: {}", namespace, key, e.getMessage());
            return new Lookup(null, stale);
        } finally {
            metricsCollector.recordTimer("collab.cache.latency", elapsedMs(start), "operation", "read");
        }
        if (stored == null) {
            return new Lookup(null, stale);
        }
        if (stored.isExpired(now)) {
            if (evictExpired) {
                safeRemove(namespace, key);
            }
            return new Lookup(null, stored);
        }
        stored.recordAccess(now);
        if (localTier != null) {
            localTier.put(localKey(namespace, key), stored);
        }
        return new Lookup(stored, null);
    }

    private <T> Optional<T> convert(CacheEntry entry, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(entry.getData(), type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Cached value {}:{} is not a {}, treating as miss", entry.getNamespace(), entry.getKey(), type.getSimpleName());
            return Optional.empty();
        }
    }

    private boolean tryLock(String lockKey, String owner, Duration lease) {
        try {
            return remote.tryLock(lockKey, owner, lease);
        } catch (RuntimeException e) {
            log.warn("Could not acquire fetch lock {}: {}", lockKey, e.getMessage());
            return false;
        }
    }

    private void releaseLock(String lockKey, String owner) {
        try {
            remote.unlock(lockKey, owner);
        } catch (RuntimeException e) {
            log.warn("Could not release fetch lock {}, it will expire on its own: {}", lockKey, e.getMessage());
        }
    }

    private void safeRemove(String namespace, String key) {
        try {
            removeEntry(namespace, key, null);
        } catch (RuntimeException e) {
            log.debug("Could not evict expired entry {}:{}: {}", namespace, key, e.getMessage());
        }
    }

    /**
     * Removes the stored entry and its tag memberships. {@code local} supplies the tags when the
     * remote copy is already gone.
     */
    private boolean removeEntry(String namespace, String key, CacheEntry local) {
        CacheEntry stored = remote.read(namespace, key).orElse(local);
        boolean removed = remote.remove(namespace, key);
        if (stored != null && stored.getTags() != null) {
            for (String tag : stored.getTags()) {
                remote.untag(namespace, tag, key);
            }
        }
        return removed;
    }

    private boolean carriesTag(String namespace, String key, String tag) {
        return remote.read(namespace, key)
                .map(entry -> entry.getTags() != null && entry.getTags().contains(tag))
                .orElse(false);
    }

    private boolean isOlderThan(String namespace, String key, long cutoff) {
        CacheEntry local = localTier != null ? localTier.getIfPresent(localKey(namespace, key)) : null;
        if (local != null && local.getTimestamp() < cutoff) {
            return true;
        }
        return remote.read(namespace, key).map(entry -> entry.getTimestamp() < cutoff).orElse(false);
    }

    private Set<String> localKeys(String namespace) {
        Set<String> keys = new HashSet<>();
        if (localTier == null) {
            return keys;
        }
        String prefix = namespace + ":";
        localTier.asMap().keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .forEach(k -> keys.add(k.substring(prefix.length())));
        return keys;
    }

    private boolean invalidateLocal(String namespace, String key) {
        return evictLocal(namespace, key) != null;
    }

    private CacheEntry evictLocal(String namespace, String key) {
        if (localTier == null) {
            return null;
        }
        return localTier.asMap().remove(localKey(namespace, key));
    }

    private void recordRead(String namespace, NamespaceStats nsStats, boolean hit) {
        if (hit) {
            nsStats.hits.increment();
        } else {
            nsStats.misses.increment();
        }
        metricsCollector.incrementCounter("collab.cache.requests", "namespace", namespace, "result", hit ? "hit" : "miss");
    }

    private NamespaceStats requireNamespace(String namespace) {
        NamespaceStats nsStats = namespace != null ? stats.get(namespace) : null;
        if (nsStats == null) {
            throw new UnknownNamespaceException(namespace);
        }
        return nsStats;
    }

    private AppProperties.Cache.Namespace requireSettings(String namespace) {
        requireNamespace(namespace);
        return settings.getNamespaces().get(namespace);
    }

    private static Duration effectiveTtl(AppProperties.Cache.Namespace nsSettings, Duration requested) {
        Duration ttl = requested != null ? requested : nsSettings.getDefaultTtl();
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        return ttl.compareTo(nsSettings.getMaxTtl()) > 0 ? nsSettings.getMaxTtl() : ttl;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (String part : glob.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }

    private static String localKey(String namespace, String key) {
        return namespace + ":" + key;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static class Lookup {
        private final CacheEntry fresh;
        private final CacheEntry stale;

        Lookup(CacheEntry fresh, CacheEntry stale) {
            this.fresh = fresh;
            this.stale = stale;
        }
    }
}
