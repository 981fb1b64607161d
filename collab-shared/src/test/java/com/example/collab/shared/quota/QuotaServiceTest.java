package com.example.collab.shared.quota;

import com.example.collab.shared.audit.AuditEvent;
import com.example.collab.shared.audit.AuditLogSink;
import com.example.collab.shared.cache.InMemoryCacheBackend;
import com.example.collab.shared.cache.TieredCacheService;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.config.MonitoringConfig;
import com.example.collab.shared.support.MutableClock;
import com.example.collab.shared.user.SubscriptionTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuotaServiceTest {

    private static final Instant START = Instant.parse("2024-05-01T10:15:30Z");

    private MutableClock clock;
    private AppProperties appProperties;
    private InMemoryQuotaCounterStore counterStore;
    private UserTierResolver tierResolver;
    private AuditLogSink auditLogSink;
    private TieredCacheService cacheService;
    private QuotaService quotaService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        appProperties = new AppProperties();
        counterStore = new InMemoryQuotaCounterStore(clock);
        tierResolver = mock(UserTierResolver.class);
        when(tierResolver.resolveTier(any())).thenReturn(SubscriptionTier.FREE);
        auditLogSink = mock(AuditLogSink.class);
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        cacheService = new TieredCacheService(
                new InMemoryCacheBackend(objectMapper, clock),
                Caffeine.newBuilder().build(),
                objectMapper,
                appProperties,
                mock(TaskScheduler.class),
                new MonitoringConfig.CollabMetricsCollector(new SimpleMeterRegistry()),
                clock);
        quotaService = newService(counterStore);
    }

    private QuotaService newService(QuotaCounterStore store) {
        return new QuotaService(store, new QuotaLimits(), tierResolver, cacheService, auditLogSink,
                new MonitoringConfig.CollabMetricsCollector(new SimpleMeterRegistry()), appProperties, clock);
    }

    private static QuotaRequest request(String identifier, long customLimit) {
        return QuotaRequest.builder()
                .identifier(identifier)
                .quotaType(QuotaLimits.API_REQUESTS)
                .customLimit(customLimit)
                .customPeriod(QuotaPeriod.MINUTE)
                .build();
    }

    @Test
    void exactlyLimitRequestsAreAllowedWithinOneWindow() {
        List<QuotaDecision> decisions = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            decisions.add(quotaService.checkAndConsume(request("user-1", 5)));
        }

        assertThat(decisions).filteredOn(QuotaDecision::isAllowed).hasSize(5);
        assertThat(decisions.get(4).getRemaining()).isZero();
        QuotaDecision rejected = decisions.get(5);
        assertThat(rejected.isAllowed()).isFalse();
        assertThat(rejected.getReason()).isEqualTo(QuotaDecision.Reason.QUOTA_EXCEEDED);
        assertThat(rejected.getRemaining()).isZero();
        assertThat(rejected.getRetryAfterMs()).isEqualTo(Duration.ofSeconds(30).toMillis());
    }

    @Test
    void rejectionWritesAuditEvent() {
        quotaService.checkAndConsume(request("user-1", 1));
        quotaService.checkAndConsume(request("user-1", 1));

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditLogSink).append(captor.capture());
        assertThat(captor.getValue().getAction()).isEqualTo("rate_limit_hit");
        assertThat(captor.getValue().getSeverity()).isEqualTo("warning");
        assertThat(captor.getValue().getUserId()).isEqualTo("user-1");
    }

    @Test
    void newWindowStartsFromZero() {
        quotaService.checkAndConsume(request("user-1", 1));
        assertThat(quotaService.checkAndConsume(request("user-1", 1)).isAllowed()).isFalse();

        clock.advance(Duration.ofSeconds(30));

        QuotaDecision next = quotaService.checkAndConsume(request("user-1", 1));
        assertThat(next.isAllowed()).isTrue();
        assertThat(next.getResetAtEpochMs()).isEqualTo(Instant.parse("2024-05-01T10:17:00Z").toEpochMilli());
    }

    @Test
    void tierMultiplierScalesConfiguredLimit() {
        when(tierResolver.resolveTier("pro-user")).thenReturn(SubscriptionTier.PRO);

        QuotaDecision decision = quotaService.checkAndConsume(QuotaRequest.builder()
                .identifier("pro-user")
                .quotaType(QuotaLimits.API_REQUESTS)
                .build());

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getLimit()).isEqualTo(500);
        assertThat(decision.getRemaining()).isEqualTo(499);
    }

    @Test
    void unknownQuotaTypeWithoutCustomLimitIsDenied() {
        QuotaDecision decision = quotaService.checkAndConsume(QuotaRequest.builder()
                .identifier("user-1")
                .quotaType("teleports")
                .build());

        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getLimit()).isZero();
    }

    @Test
    void storeFailureFailsOpen() {
        QuotaCounterStore broken = mock(QuotaCounterStore.class);
        when(broken.getOrCreate(any(), anyLong(), anyBoolean()))
                .thenThrow(new DataAccessResourceFailureException("database unavailable"));
        QuotaService service = newService(broken);

        QuotaDecision decision = service.checkAndConsume(request("user-1", 5));

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getReason()).isEqualTo(QuotaDecision.Reason.FAIL_OPEN_ON_ERROR);
        assertThat(decision.getRemaining()).isEqualTo(100);
        assertThat(decision.getLimit()).isEqualTo(100);
        assertThat(service.getStats()).containsEntry("failOpen", 1L);
    }

    @Test
    void bypassIdentifierIsUnlimited() {
        QuotaCounterStore untouched = mock(QuotaCounterStore.class);
        QuotaService service = newService(untouched);

        QuotaDecision decision = service.checkAndConsume(QuotaRequest.builder()
                .identifier("internal-monitor")
                .quotaType(QuotaLimits.API_REQUESTS)
                .bypassIdentifier("internal-monitor")
                .build());

        assertThat(decision.getReason()).isEqualTo(QuotaDecision.Reason.BYPASSED);
        assertThat(decision.getRemaining()).isEqualTo(Long.MAX_VALUE);
        verify(untouched, never()).getOrCreate(any(), anyLong(), anyBoolean());
    }

    @Test
    void resetClearsUsageAndCachedCounter() {
        quotaService.checkAndConsume(request("user-1", 2));
        quotaService.checkAndConsume(request("user-1", 2));
        assertThat(quotaService.checkAndConsume(request("user-1", 2)).isAllowed()).isFalse();

        assertThat(quotaService.resetQuota("user-1", QuotaLimits.API_REQUESTS, QuotaPeriod.MINUTE)).isTrue();

        assertThat(quotaService.getUsage("user-1", QuotaLimits.API_REQUESTS, QuotaPeriod.MINUTE).getUsed()).isZero();
        assertThat(quotaService.checkAndConsume(request("user-1", 2)).isAllowed()).isTrue();
    }

    @Test
    void overrideReplacesTierLimit() {
        QuotaRequest hourly = QuotaRequest.builder()
                .identifier("user-2")
                .quotaType(QuotaLimits.FILE_UPLOADS)
                .customPeriod(QuotaPeriod.HOUR)
                .build();
        quotaService.checkAndConsume(hourly);

        quotaService.setOverride("user-2", QuotaLimits.FILE_UPLOADS, 1, QuotaPeriod.HOUR);

        QuotaDecision decision = quotaService.checkAndConsume(hourly);
        assertThat(decision.isAllowed()).isFalse();
        assertThat(decision.getLimit()).isEqualTo(1);
        QuotaUsage usage = quotaService.getUsage("user-2", QuotaLimits.FILE_UPLOADS, QuotaPeriod.HOUR);
        assertThat(usage.getUsed()).isEqualTo(1);
        assertThat(usage.getLimit()).isEqualTo(1);
        assertThat(usage.getRemaining()).isZero();
    }

    @Test
    void ipIdentifiersAreTrackedAsAnonymous() {
        quotaService.checkAndConsume(request("203.0.113.7", 5));

        QuotaWindow window = QuotaPeriod.MINUTE.windowFor("203.0.113.7", QuotaLimits.API_REQUESTS, START);
        assertThat(counterStore.find(window)).hasValueSatisfying(counter -> assertThat(counter.isAnonymous()).isTrue());
    }
}
