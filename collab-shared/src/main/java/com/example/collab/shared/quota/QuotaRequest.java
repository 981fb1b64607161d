package com.example.collab.shared.quota;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QuotaRequest {
    private String identifier;
    private String quotaType;
    @Builder.Default
    private long amount = 1;
    /** Replaces the tier-derived limit for this call. */
    private Long customLimit;
    private QuotaPeriod customPeriod;
    private String bypassIdentifier;
}
