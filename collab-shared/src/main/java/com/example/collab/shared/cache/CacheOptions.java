package com.example.collab.shared.cache;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.Set;

@Data
@Builder
public class CacheOptions {
    /** Falls back to the namespace default when null; always clamped to the namespace maximum. */
    private Duration ttl;
    private Set<String> tags;
    private Long version;
    private boolean staleWhileRevalidate;
    /** Lease on the advisory fetch lock taken by {@code getOrSet}. */
    private Duration lockTimeout;

    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }

    public static CacheOptions ttl(Duration ttl) {
        return CacheOptions.builder().ttl(ttl).build();
    }
}
