package com.example.collab.shared.quota;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaDecision {

    public enum Reason {
        OK,
        QUOTA_EXCEEDED,
        /** Allowed because the quota could not be evaluated. */
        FAIL_OPEN_ON_ERROR,
        BYPASSED
    }

    private boolean allowed;
    private long remaining;
    private long limit;
    private long resetAtEpochMs;
    private Long retryAfterMs;
    private Reason reason;
}
