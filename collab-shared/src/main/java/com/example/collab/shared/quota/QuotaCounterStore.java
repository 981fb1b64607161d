package com.example.collab.shared.quota;

import java.time.Instant;
import java.util.Optional;

/**
 * Authoritative counter storage. {@link #tryConsume} must be atomic with respect to concurrent callers.
 */
public interface QuotaCounterStore {

    QuotaCounter getOrCreate(QuotaWindow window, long limit, boolean anonymous);

    Optional<QuotaCounter> find(QuotaWindow window);

    Optional<QuotaCounter> findById(long id);

    /**
     * Adds {@code amount} only if the result stays within {@code limit}.
     *
     * @return the updated counter, or empty if the increment would exceed the limit
     */
    Optional<QuotaCounter> tryConsume(long counterId, long amount, long limit);

    boolean reset(QuotaWindow window);

    QuotaCounter overrideLimit(QuotaWindow window, long newLimit, boolean anonymous);

    QuotaTypeStats summarize(String quotaType, QuotaPeriod period, Instant periodStart);

    int deleteEndedBefore(Instant cutoff);
}
