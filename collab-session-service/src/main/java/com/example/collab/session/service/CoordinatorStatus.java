package com.example.collab.session.service;

import com.example.collab.shared.cache.CacheHealth;
import com.example.collab.shared.cache.CacheService;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.quota.QuotaService;
import com.example.collab.shared.store.DurableStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only health and statistics views of the coordinator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoordinatorStatus {

    private final SessionCoordinator sessionCoordinator;
    private final RoomCoordinator roomCoordinator;
    private final ConnectionRegistry connectionRegistry;
    private final CoordinatorMetrics coordinatorMetrics;
    private final QuotaService quotaService;
    private final CacheService cacheService;
    private final DurableStore store;
    private final AppProperties appProperties;
    private final Clock clock;

    private volatile Map<String, Object> lastHealth;

    /**
     * @return the health document; {@code status} is {@code unhealthy} if any check failed
     */
    public Map<String, Object> health() {
        long start = clock.millis();
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("instanceId", appProperties.getService().getName());
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("activeConnections", connectionRegistry.activeCount());
            details.put("totalSessions", sessionCoordinator.totalSessions());
            details.put("activeRooms", roomCoordinator.activeRooms());
            details.put("storageKeys", store.keys("").size());
            CacheHealth cacheHealth = cacheService.healthCheck();
            details.put("cache", cacheHealth);
            details.putAll(coordinatorMetrics.snapshot());

            health.put("status", cacheHealth.getStatus() == CacheHealth.Status.UNHEALTHY ? "degraded" : "healthy");
            health.put("details", details);
        } catch (Exception e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            health.put("status", "unhealthy");
            health.put("error", e.getMessage());
        }
        health.put("timestamp", clock.millis());
        health.put("responseTime", clock.millis() - start);
        lastHealth = health;
        return health;
    }

    public boolean isHealthy(Map<String, Object> health) {
        return !"unhealthy".equals(health.get("status"));
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("activeConnections", connectionRegistry.activeCount());
        stats.put("totalSessions", sessionCoordinator.totalSessions());
        stats.put("activeRooms", roomCoordinator.activeRooms());
        stats.put("storageKeys", store.keys("").size());
        stats.put("healthCheck", lastHealth);
        stats.put("metrics", coordinatorMetrics.snapshot());
        stats.put("rateLimitStats", quotaService.getStats());
        stats.put("cacheStats", cacheService.getStats());
        stats.put("timestamp", clock.millis());
        return stats;
    }
}
