package com.example.collab.shared.quota;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaTypeStats {
    private String quotaType;
    private QuotaPeriod period;
    private long counters;
    private long exhausted;
    private long totalUsed;
    private double averageUtilization;
}
