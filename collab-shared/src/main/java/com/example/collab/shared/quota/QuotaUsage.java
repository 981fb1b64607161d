package com.example.collab.shared.quota;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaUsage {
    private long used;
    private long limit;
    private long remaining;
    private long resetAtEpochMs;
    private long periodStart;
    private long periodEnd;
}
