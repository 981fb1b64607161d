package com.example.collab.shared.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * A cached value with its bookkeeping. The payload is kept as a JSON tree so both tiers
 * can hold it without knowing the caller's type.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    private String namespace;
    private String key;
    private JsonNode data;
    private long timestamp;
    private Long ttlSeconds;
    @Builder.Default
    private Set<String> tags = new HashSet<>();
    private long accessCount;
    private long lastAccessedAt;
    private long version;

    /**
     * An entry is expired iff {@code now - timestamp > ttl * 1000}. Entries without a TTL never expire.
     */
    @JsonIgnore
    public boolean isExpired(long nowMs) {
        return ttlSeconds != null && nowMs - timestamp > ttlSeconds * 1000L;
    }

    public void recordAccess(long nowMs) {
        accessCount++;
        lastAccessedAt = nowMs;
    }
}
