package com.example.collab.session.controller;

import com.example.collab.session.service.CoordinatorStatus;
import com.example.collab.session.support.CoordinatorHarness;
import com.example.collab.shared.cache.CacheHealth;
import com.example.collab.shared.cache.CacheService;
import com.example.collab.shared.store.DurableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private CoordinatorHarness harness;
    private CacheService cacheService;

    @BeforeEach
    void setUp() {
        harness = new CoordinatorHarness();
        cacheService = mock(CacheService.class);
        when(cacheService.healthCheck()).thenReturn(CacheHealth.builder()
                .status(CacheHealth.Status.HEALTHY)
                .responseTimeMs(1)
                .build());
        when(cacheService.getStats()).thenReturn(Map.of());
        when(harness.quotaService.getStats()).thenReturn(Map.of("totalChecks", 0));
    }

    private WebTestClient clientWith(DurableStore store) {
        CoordinatorStatus status = new CoordinatorStatus(harness.sessions, harness.rooms, harness.registry,
                harness.metrics, harness.quotaService, cacheService, store, harness.appProperties, harness.clock);
        return WebTestClient.bindToController(new HealthController(status)).build();
    }

    @Test
    void healthyInstance() {
        harness.sessions.createSession("s1", "alice", null, null, null);

        clientWith(harness.store).get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.details.totalSessions").isEqualTo(1)
                .jsonPath("$.details.cache.status").isEqualTo("HEALTHY");
    }

    @Test
    void degradedCacheStillAnswers200() {
        when(cacheService.healthCheck()).thenReturn(CacheHealth.builder()
                .status(CacheHealth.Status.UNHEALTHY)
                .error("connection refused")
                .build());

        clientWith(harness.store).get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded");
    }

    @Test
    void failingHealthCheckIs500() {
        DurableStore broken = mock(DurableStore.class);
        when(broken.keys(anyString())).thenThrow(new IllegalStateException("store offline"));

        clientWith(broken).get().uri("/health")
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.status").isEqualTo("unhealthy")
                .jsonPath("$.error").isEqualTo("store offline");
    }

    @Test
    void statsIncludeLastHealthAndQuotaStats() {
        WebTestClient client = clientWith(harness.store);
        client.get().uri("/health").exchange().expectStatus().isOk();

        client.get().uri("/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.healthCheck.status").isEqualTo("healthy")
                .jsonPath("$.rateLimitStats.totalChecks").isEqualTo(0)
                .jsonPath("$.activeRooms").isEqualTo(0);
    }
}
