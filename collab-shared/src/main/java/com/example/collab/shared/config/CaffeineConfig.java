package com.example.collab.shared.config;

import com.example.collab.shared.cache.CacheEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.AllArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@AllArgsConstructor
public class CaffeineConfig {

    private final AppProperties appProperties;

    /**
     * Process-local tier in front of the remote cache. Freshness is decided by the entry's own TTL,
     * so the physical expiry only bounds memory.
     */
    @Bean
    public Cache<String, CacheEntry> localCacheTier() {
        Duration longestTtl = appProperties.getCache().getNamespaces().values().stream()
                .map(AppProperties.Cache.Namespace::getMaxTtl)
                .max(Duration::compareTo)
                .orElse(Duration.ofHours(24));
        return Caffeine.newBuilder()
                .maximumSize(appProperties.getCache().getLocalMaximumSize())
                .expireAfterWrite(longestTtl.plus(appProperties.getCache().getStaleGrace()))
                .recordStats()
                .build();
    }
}
