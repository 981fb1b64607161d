package com.example.collab.shared.quota;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Usage within one fixed window. {@code usedCount} only grows inside the window; the next window
 * gets its own row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuotaCounter {
    private Long id;
    private String identifier;
    private String quotaType;
    private QuotaPeriod period;
    private Instant periodStart;
    private Instant periodEnd;
    private long usedCount;
    private long limitCount;
    /** Limit was set administratively and wins over the tier-derived limit. */
    private boolean overridden;
    private boolean anonymous;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public long getRemaining() {
        return Math.max(0, limitCount - usedCount);
    }
}
