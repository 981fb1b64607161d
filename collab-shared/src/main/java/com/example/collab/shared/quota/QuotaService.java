package com.example.collab.shared.quota;

import com.example.collab.shared.aspect.Monitored;
import com.example.collab.shared.audit.AuditEvent;
import com.example.collab.shared.audit.AuditLogSink;
import com.example.collab.shared.cache.CacheOptions;
import com.example.collab.shared.cache.CacheService;
import com.example.collab.shared.cache.InvalidationCriteria;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.config.MonitoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Fixed-window quota enforcement. Counters are read through the {@code rate_limit} cache namespace and
 * consumed atomically in the {@link QuotaCounterStore}; any unexpected failure fails open.
 */
@Service
@Slf4j
public class QuotaService {

    static final String RATE_LIMIT_NAMESPACE = "rate_limit";
    static final String RATE_LIMIT_TAG = "rate_limit";
    private static final Duration BYPASS_RESET = Duration.ofHours(24);
    private static final Duration FAIL_OPEN_RESET = Duration.ofHours(1);

    private final QuotaCounterStore counterStore;
    private final QuotaLimits quotaLimits;
    private final UserTierResolver tierResolver;
    private final CacheService cacheService;
    private final AuditLogSink auditLogSink;
    private final MonitoringConfig.CollabMetricsCollector metricsCollector;
    private final AppProperties.Quota settings;
    private final Clock clock;

    private final LongAdder totalChecks = new LongAdder();
    private final LongAdder allowed = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder failOpen = new LongAdder();
    private final LongAdder bypassed = new LongAdder();

    public QuotaService(QuotaCounterStore counterStore,
                        QuotaLimits quotaLimits,
                        UserTierResolver tierResolver,
                        CacheService cacheService,
                        AuditLogSink auditLogSink,
                        MonitoringConfig.CollabMetricsCollector metricsCollector,
                        AppProperties appProperties,
                        Clock clock) {
        this.counterStore = counterStore;
        this.quotaLimits = quotaLimits;
        this.tierResolver = tierResolver;
        this.cacheService = cacheService;
        this.auditLogSink = auditLogSink;
        this.metricsCollector = metricsCollector;
        this.settings = appProperties.getQuota();
        this.clock = clock;
    }

    public QuotaDecision checkAndConsume(QuotaRequest request) {
        totalChecks.increment();
        if (isBypassed(request)) {
            bypassed.increment();
            return QuotaDecision.builder()
                    .allowed(true)
                    .remaining(Long.MAX_VALUE)
                    .limit(Long.MAX_VALUE)
                    .resetAtEpochMs(clock.millis() + BYPASS_RESET.toMillis())
                    .reason(QuotaDecision.Reason.BYPASSED)
                    .build();
        }

        try {
            QuotaDecision decision = consume(request);
            metricsCollector.incrementCounter("collab.quota.checks", "reason", decision.getReason().name().toLowerCase());
            return decision;
        } catch (Exception e) {
            failOpen.increment();
            metricsCollector.incrementCounter("collab.quota.checks", "reason", "fail_open_on_error");
            log.warn("Quota check failed for {}:{}, allowing request: {}", request.getIdentifier(), request.getQuotaType(), e.getMessage());
            return QuotaDecision.builder()
                    .allowed(true)
                    .remaining(settings.getFailOpenLimit())
                    .limit(settings.getFailOpenLimit())
                    .resetAtEpochMs(clock.millis() + FAIL_OPEN_RESET.toMillis())
                    .reason(QuotaDecision.Reason.FAIL_OPEN_ON_ERROR)
                    .build();
        }
    }

    private QuotaDecision consume(QuotaRequest request) {
        if (request.getAmount() <= 0) {
            throw new IllegalArgumentException("Quota amount must be positive");
        }
        Instant now = clock.instant();
        Optional<QuotaLimit> limitConfig = quotaLimits.find(request.getQuotaType(), request.getCustomPeriod());
        if (limitConfig.isEmpty() && request.getCustomLimit() == null) {
            rejected.increment();
            return QuotaDecision.builder()
                    .allowed(false)
                    .remaining(0)
                    .limit(0)
                    .resetAtEpochMs(now.toEpochMilli() + FAIL_OPEN_RESET.toMillis())
                    .reason(QuotaDecision.Reason.QUOTA_EXCEEDED)
                    .build();
        }

        QuotaPeriod period = request.getCustomPeriod() != null
                ? request.getCustomPeriod()
                : limitConfig.map(QuotaLimit::getPeriod).orElse(QuotaPeriod.HOUR);
        QuotaWindow window = period.windowFor(request.getIdentifier(), request.getQuotaType(), now);
        long tierLimit = request.getCustomLimit() != null
                ? request.getCustomLimit()
                : limitConfig.get().limitFor(tierResolver.resolveTier(request.getIdentifier()));

        Optional<QuotaCounter> cached = readCachedCounter(window);
        if (cached.isPresent()) {
            QuotaCounter counter = cached.get();
            long limit = effectiveLimit(counter, tierLimit, request);
            if (counter.getUsedCount() + request.getAmount() > limit) {
                return reject(window, limit, counter.getUsedCount(), now);
            }
        }

        boolean anonymous = IdentifierClassifier.isIpAddress(request.getIdentifier());
        QuotaCounter counter = counterStore.getOrCreate(window, tierLimit, anonymous);
        long limit = effectiveLimit(counter, tierLimit, request);
        Optional<QuotaCounter> consumed = counterStore.tryConsume(counter.getId(), request.getAmount(), limit);
        if (consumed.isPresent()) {
            QuotaCounter updated = consumed.get();
            writeCachedCounter(window, updated);
            allowed.increment();
            return QuotaDecision.builder()
                    .allowed(true)
                    .remaining(Math.max(0, limit - updated.getUsedCount()))
                    .limit(limit)
                    .resetAtEpochMs(window.getEnd().toEpochMilli())
                    .reason(QuotaDecision.Reason.OK)
                    .build();
        }

        QuotaCounter latest = counterStore.findById(counter.getId()).orElse(counter);
        writeCachedCounter(window, latest);
        return reject(window, limit, latest.getUsedCount(), now);
    }

    private QuotaDecision reject(QuotaWindow window, long limit, long used, Instant now) {
        rejected.increment();
        long retryAfter = window.getEnd().toEpochMilli() - now.toEpochMilli();
        if (settings.isAuditEnabled()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("identifier", window.getIdentifier());
            details.put("quotaType", window.getQuotaType());
            details.put("period", window.getPeriod().value());
            details.put("limit", limit);
            details.put("used", used);
            try {
                auditLogSink.append(AuditEvent.builder()
                        .action("rate_limit_hit")
                        .userId(IdentifierClassifier.isIpAddress(window.getIdentifier()) ? null : window.getIdentifier())
                        .resourceType("quota")
                        .resourceId(window.getQuotaType())
                        .severity("warning")
                        .details(details)
                        .timestamp(now)
                        .build());
            } catch (RuntimeException e) {
                log.warn("Could not record rate limit hit for {}: {}", window.getIdentifier(), e.getMessage());
            }
        }
        log.debug("Quota exceeded for {}:{} ({} of {} used)", window.getIdentifier(), window.getQuotaType(), used, limit);
        return QuotaDecision.builder()
                .allowed(false)
                .remaining(0)
                .limit(limit)
                .resetAtEpochMs(window.getEnd().toEpochMilli())
                .retryAfterMs(retryAfter)
                .reason(QuotaDecision.Reason.QUOTA_EXCEEDED)
                .build();
    }

    public boolean resetQuota(String identifier, String quotaType, QuotaPeriod period) {
        QuotaWindow window = windowFor(identifier, quotaType, period);
        boolean reset = counterStore.reset(window);
        evictCounter(identifier, quotaType);
        log.info("Quota {} for {} reset (counter existed: {})", quotaType, identifier, reset);
        return reset;
    }

    public QuotaCounter setOverride(String identifier, String quotaType, long newLimit, QuotaPeriod period) {
        if (newLimit < 0) {
            throw new IllegalArgumentException("Quota limit must not be negative");
        }
        QuotaWindow window = windowFor(identifier, quotaType, period);
        QuotaCounter counter = counterStore.overrideLimit(window, newLimit, IdentifierClassifier.isIpAddress(identifier));
        evictCounter(identifier, quotaType);
        log.info("Quota {} for {} overridden to {} for the current {}", quotaType, identifier, newLimit, window.getPeriod().value());
        return counter;
    }

    public QuotaUsage getUsage(String identifier, String quotaType, QuotaPeriod period) {
        QuotaWindow window = windowFor(identifier, quotaType, period);
        Optional<QuotaCounter> counter = counterStore.find(window);
        long used = counter.map(QuotaCounter::getUsedCount).orElse(0L);
        long limit = counter.map(QuotaCounter::getLimitCount)
                .orElseGet(() -> quotaLimits.find(quotaType, window.getPeriod())
                        .map(l -> l.limitFor(tierResolver.resolveTier(identifier)))
                        .orElse(0L));
        return QuotaUsage.builder()
                .used(used)
                .limit(limit)
                .remaining(Math.max(0, limit - used))
                .resetAtEpochMs(window.getEnd().toEpochMilli())
                .periodStart(window.getStart().toEpochMilli())
                .periodEnd(window.getEnd().toEpochMilli())
                .build();
    }

    @Monitored("service")
    public QuotaTypeStats getQuotaTypeStats(String quotaType, QuotaPeriod period) {
        QuotaPeriod effective = period != null ? period : QuotaPeriod.HOUR;
        return counterStore.summarize(quotaType, effective, effective.windowStart(clock.instant()));
    }

    /**
     * Drops cached counters for one identifier, or every cached counter when {@code identifier} is null.
     */
    public int invalidateCache(String identifier) {
        String tag = identifier != null ? "identifier:" + identifier : RATE_LIMIT_TAG;
        try {
            return cacheService.invalidate(InvalidationCriteria.builder()
                    .namespace(RATE_LIMIT_NAMESPACE)
                    .tags(Set.of(tag))
                    .build());
        } catch (RuntimeException e) {
            log.warn("Could not invalidate cached quota counters for {}: {}", identifier, e.getMessage());
            return 0;
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalChecks", totalChecks.sum());
        stats.put("allowed", allowed.sum());
        stats.put("rejected", rejected.sum());
        stats.put("failOpen", failOpen.sum());
        stats.put("bypassed", bypassed.sum());
        return stats;
    }

    private boolean isBypassed(QuotaRequest request) {
        String identifier = request.getIdentifier();
        if (identifier == null) {
            return false;
        }
        return identifier.equals(request.getBypassIdentifier()) || identifier.equals(settings.getBypassIdentifier());
    }

    private static long effectiveLimit(QuotaCounter counter, long tierLimit, QuotaRequest request) {
        if (request.getCustomLimit() != null) {
            return request.getCustomLimit();
        }
        return counter.isOverridden() ? counter.getLimitCount() : tierLimit;
    }

    private QuotaWindow windowFor(String identifier, String quotaType, QuotaPeriod period) {
        QuotaPeriod effective = period != null
                ? period
                : quotaLimits.find(quotaType, null).map(QuotaLimit::getPeriod).orElse(QuotaPeriod.HOUR);
        return effective.windowFor(identifier, quotaType, clock.instant());
    }

    private Optional<QuotaCounter> readCachedCounter(QuotaWindow window) {
        try {
            return cacheService.get(RATE_LIMIT_NAMESPACE, window.cacheKey(), QuotaCounter.class);
        } catch (RuntimeException e) {
            log.debug("Cached counter unavailable for {}: {}", window.cacheKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCachedCounter(QuotaWindow window, QuotaCounter counter) {
        try {
            cacheService.set(RATE_LIMIT_NAMESPACE, window.cacheKey(), counter, CacheOptions.builder()
                    .ttl(settings.getCounterCacheTtl())
                    .tags(Set.of(
                            RATE_LIMIT_TAG,
                            "identifier:" + window.getIdentifier(),
                            "quota_type:" + window.getQuotaType(),
                            counterTag(window.getIdentifier(), window.getQuotaType())))
                    .build());
        } catch (RuntimeException e) {
            log.warn("Could not cache quota counter {}: {}", window.cacheKey(), e.getMessage());
        }
    }

    private void evictCounter(String identifier, String quotaType) {
        cacheService.invalidate(InvalidationCriteria.builder()
                .namespace(RATE_LIMIT_NAMESPACE)
                .tags(Set.of(counterTag(identifier, quotaType)))
                .build());
    }

    private static String counterTag(String identifier, String quotaType) {
        return "counter:" + identifier + ":" + quotaType;
    }
}
