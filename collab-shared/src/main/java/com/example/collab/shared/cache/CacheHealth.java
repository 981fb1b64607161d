package com.example.collab.shared.cache;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class CacheHealth {

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }

    private Status status;
    private long responseTimeMs;
    private String error;
    private Map<String, Object> details;
}
