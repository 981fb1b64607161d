package com.example.collab.shared.cache;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class WarmupEntry<T> {
    private String namespace;
    private String key;
    private Class<T> type;
    private ValueLoader<T> loader;
    private CacheOptions options;
    private int priority;
}
