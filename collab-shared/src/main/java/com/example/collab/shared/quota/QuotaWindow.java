package com.example.collab.shared.quota;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class QuotaWindow {
    private final String identifier;
    private final String quotaType;
    private final QuotaPeriod period;
    private final Instant start;
    private final Instant end;

    public String cacheKey() {
        return "quota:" + identifier + ":" + quotaType + ":" + period.value() + ":" + start.toEpochMilli();
    }
}
