package com.example.collab.shared.quota;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-local counters. Every method is synchronized, which makes {@link #tryConsume} atomic.
 */
@Component
@ConditionalOnProperty(prefix = "collab.quota", name = "store-type", havingValue = "memory")
public class InMemoryQuotaCounterStore implements QuotaCounterStore {

    private final Map<Long, QuotaCounter> countersById = new HashMap<>();
    private final Map<String, Long> idsByWindow = new HashMap<>();
    private final Clock clock;
    private long nextId = 1;

    public InMemoryQuotaCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized QuotaCounter getOrCreate(QuotaWindow window, long limit, boolean anonymous) {
        return find(window).orElseGet(() -> insert(window, limit, false, anonymous));
    }

    @Override
    public synchronized Optional<QuotaCounter> find(QuotaWindow window) {
        Long id = idsByWindow.get(window.cacheKey());
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public synchronized Optional<QuotaCounter> findById(long id) {
        QuotaCounter counter = countersById.get(id);
        return counter == null ? Optional.empty() : Optional.of(counter.toBuilder().build());
    }

    @Override
    public synchronized Optional<QuotaCounter> tryConsume(long counterId, long amount, long limit) {
        QuotaCounter counter = countersById.get(counterId);
        if (counter == null || counter.getUsedCount() + amount > limit) {
            return Optional.empty();
        }
        counter.setUsedCount(counter.getUsedCount() + amount);
        counter.setLimitCount(limit);
        counter.setUpdatedAt(clock.instant());
        return Optional.of(counter.toBuilder().build());
    }

    @Override
    public synchronized boolean reset(QuotaWindow window) {
        Long id = idsByWindow.get(window.cacheKey());
        if (id == null) {
            return false;
        }
        QuotaCounter counter = countersById.get(id);
        counter.setUsedCount(0);
        counter.setUpdatedAt(clock.instant());
        return true;
    }

    @Override
    public synchronized QuotaCounter overrideLimit(QuotaWindow window, long newLimit, boolean anonymous) {
        Long id = idsByWindow.get(window.cacheKey());
        if (id == null) {
            return insert(window, newLimit, true, anonymous);
        }
        QuotaCounter counter = countersById.get(id);
        counter.setLimitCount(newLimit);
        counter.setOverridden(true);
        counter.setUpdatedAt(clock.instant());
        return counter.toBuilder().build();
    }

    @Override
    public synchronized QuotaTypeStats summarize(String quotaType, QuotaPeriod period, Instant periodStart) {
        List<QuotaCounter> matching = countersById.values().stream()
                .filter(c -> c.getQuotaType().equals(quotaType) && c.getPeriod() == period && c.getPeriodStart().equals(periodStart))
                .collect(Collectors.toList());
        double utilization = matching.stream()
                .mapToDouble(c -> c.getLimitCount() > 0 ? c.getUsedCount() * 100.0 / c.getLimitCount() : 0)
                .average()
                .orElse(0);
        return QuotaTypeStats.builder()
                .quotaType(quotaType)
                .period(period)
                .counters(matching.size())
                .exhausted(matching.stream().filter(c -> c.getUsedCount() >= c.getLimitCount()).count())
                .totalUsed(matching.stream().mapToLong(QuotaCounter::getUsedCount).sum())
                .averageUtilization(utilization)
                .build();
    }

    @Override
    public synchronized int deleteEndedBefore(Instant cutoff) {
        List<QuotaCounter> ended = countersById.values().stream()
                .filter(c -> c.getPeriodEnd().isBefore(cutoff))
                .collect(Collectors.toList());
        for (QuotaCounter counter : ended) {
            countersById.remove(counter.getId());
            idsByWindow.values().remove(counter.getId());
        }
        return ended.size();
    }

    private QuotaCounter insert(QuotaWindow window, long limit, boolean overridden, boolean anonymous) {
        Instant now = clock.instant();
        QuotaCounter counter = QuotaCounter.builder()
                .id(nextId++)
                .identifier(window.getIdentifier())
                .quotaType(window.getQuotaType())
                .period(window.getPeriod())
                .periodStart(window.getStart())
                .periodEnd(window.getEnd())
                .limitCount(limit)
                .overridden(overridden)
                .anonymous(anonymous)
                .createdAt(now)
                .updatedAt(now)
                .build();
        countersById.put(counter.getId(), counter);
        idsByWindow.put(window.cacheKey(), counter.getId());
        return counter.toBuilder().build();
    }
}
