package com.example.collab.shared.cache;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.config.MonitoringConfig;
import com.example.collab.shared.exception.UnknownNamespaceException;
import com.example.collab.shared.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class TieredCacheServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MutableClock clock;
    private InMemoryCacheBackend backend;
    private TaskScheduler taskScheduler;
    private TieredCacheService cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        backend = new InMemoryCacheBackend(objectMapper, clock);
        taskScheduler = mock(TaskScheduler.class);
        cache = newCache(backend);
    }

    private TieredCacheService newCache(CacheBackend remote) {
        return new TieredCacheService(
                remote,
                Caffeine.newBuilder().maximumSize(1_000).recordStats().build(),
                objectMapper,
                new AppProperties(),
                taskScheduler,
                new MonitoringConfig.CollabMetricsCollector(new SimpleMeterRegistry()),
                clock);
    }

    private static WarmupEntry<String> warmupEntry(String key, int priority, List<String> loadOrder) {
        return WarmupEntry.<String>builder()
                .namespace("cache")
                .key(key)
                .type(String.class)
                .loader(() -> {
                    loadOrder.add(key);
                    return "warm-" + key;
                })
                .priority(priority)
                .build();
    }

    @Test
    void valueIsReadableUntilItsTtlElapses() {
        cache.set("cache", "greeting", Map.of("text", "hello"), CacheOptions.ttl(Duration.ofSeconds(60)));

        clock.advance(Duration.ofSeconds(60));
        assertThat(cache.get("cache", "greeting", Map.class)).hasValueSatisfying(
                value -> assertThat(value).containsEntry("text", "hello"));

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get("cache", "greeting", Map.class)).isEmpty();
    }

    @Test
    void ttlIsClampedToNamespaceMaximum() {
        cache.set("rate_limit", "counter", 5, CacheOptions.ttl(Duration.ofDays(3)));

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThat(cache.get("rate_limit", "counter", Integer.class)).isEmpty();
    }

    @Test
    void deleteReportsWhetherAnythingWasRemoved() {
        assertThat(cache.delete("cache", "missing")).isFalse();

        cache.set("cache", "present", "value", CacheOptions.defaults());

        assertThat(cache.delete("cache", "present")).isTrue();
        assertThat(cache.delete("cache", "present")).isFalse();
        assertThat(cache.get("cache", "present", String.class)).isEmpty();
    }

    @Test
    void tagInvalidationIsIdempotent() {
        CacheOptions tagged = CacheOptions.builder().tags(Set.of("user:42")).build();
        cache.set("users", "profile:42", "profile", tagged);
        cache.set("users", "settings:42", "settings", tagged);
        cache.set("users", "profile:7", "other", CacheOptions.defaults());

        assertThat(cache.invalidate(InvalidationCriteria.byTags("user:42"))).isEqualTo(2);
        assertThat(cache.invalidate(InvalidationCriteria.byTags("user:42"))).isZero();

        assertThat(cache.get("users", "profile:42", String.class)).isEmpty();
        assertThat(cache.get("users", "profile:7", String.class)).contains("other");
    }

    @Test
    void patternInvalidationMatchesKeyGlob() {
        cache.set("cache", "room:1:data", "a", CacheOptions.defaults());
        cache.set("cache", "room:2:data", "b", CacheOptions.defaults());
        cache.set("cache", "session:1", "c", CacheOptions.defaults());

        int removed = cache.invalidate(InvalidationCriteria.builder().namespace("cache").pattern("room:*").build());

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("cache", "session:1", String.class)).contains("c");
    }

    @Test
    void retaggedEntryIsNotRemovedByItsOldTag() {
        cache.set("users", "profile:42", "v1", CacheOptions.builder().tags(Set.of("team:a")).build());
        cache.set("users", "profile:42", "v2", CacheOptions.builder().tags(Set.of("team:b")).build());

        assertThat(cache.invalidate(InvalidationCriteria.byTags("team:a"))).isZero();
        assertThat(cache.get("users", "profile:42", String.class)).contains("v2");
        assertThat(backend.taggedKeys("users", "team:a")).isEmpty();

        assertThat(cache.invalidate(InvalidationCriteria.byTags("team:b"))).isEqualTo(1);
    }

    @Test
    void deletedThenRewrittenKeyDoesNotKeepItsOldTags() {
        cache.set("users", "profile:42", "v1", CacheOptions.builder().tags(Set.of("user:42")).build());
        cache.delete("users", "profile:42");
        cache.set("users", "profile:42", "v2", CacheOptions.defaults());

        assertThat(backend.taggedKeys("users", "user:42")).isEmpty();
        assertThat(cache.invalidate(InvalidationCriteria.byTags("user:42"))).isZero();
        assertThat(cache.get("users", "profile:42", String.class)).contains("v2");
    }

    @Test
    void tagSetsOfExpiredEntriesAreReclaimed() {
        CacheOptions tagged = CacheOptions.builder()
                .ttl(Duration.ofSeconds(30))
                .tags(Set.of("identifier:203.0.113.9"))
                .build();
        cache.set("rate_limit", "window:1", 1, tagged);
        cache.set("rate_limit", "window:2", 2, tagged);

        clock.advance(Duration.ofHours(2));

        assertThat(backend.sweepExpired()).isEqualTo(3);
        assertThat(backend.taggedKeys("rate_limit", "identifier:203.0.113.9")).isEmpty();
        assertThat(backend.keys("rate_limit")).isEmpty();
    }

    @Test
    void taggedKeysPrunesMembersWhoseEntryIsGone() {
        cache.set("users", "profile:1", "a", CacheOptions.builder().tags(Set.of("org:1")).build());
        cache.set("users", "profile:2", "b", CacheOptions.builder().tags(Set.of("org:1")).build());
        backend.remove("users", "profile:1");

        assertThat(backend.taggedKeys("users", "org:1")).containsExactly("profile:2");
    }

    @Test
    void olderThanRemovesOnlyEntriesWrittenBeforeTheCutoff() {
        cache.set("cache", "early", "a", CacheOptions.defaults());
        clock.advance(Duration.ofMinutes(1));
        cache.set("cache", "late", "b", CacheOptions.defaults());

        int removed = cache.invalidate(InvalidationCriteria.builder()
                .namespace("cache")
                .olderThan(clock.instant().minusSeconds(30))
                .build());

        assertThat(removed).isEqualTo(1);
        assertThat(cache.get("cache", "early", String.class)).isEmpty();
        assertThat(cache.get("cache", "late", String.class)).contains("b");
    }

    @Test
    void criteriaAreCombinedAsAUnion() {
        cache.set("cache", "report:1", "tagged", CacheOptions.builder().tags(Set.of("reports")).build());
        cache.set("cache", "tmp:1", "scratch", CacheOptions.defaults());
        cache.set("cache", "keep", "kept", CacheOptions.defaults());

        int removed = cache.invalidate(InvalidationCriteria.builder()
                .namespace("cache")
                .tags(Set.of("reports"))
                .pattern("tmp:*")
                .build());

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("cache", "keep", String.class)).contains("kept");
    }

    @Test
    void unknownNamespaceIsRejected() {
        assertThatThrownBy(() -> cache.get("nope", "key", String.class))
                .isInstanceOf(UnknownNamespaceException.class);
    }

    @Test
    void getOrSetLoadsOnceWhileFresh() {
        AtomicInteger loads = new AtomicInteger();
        ValueLoader<String> loader = () -> "value-" + loads.incrementAndGet();

        assertThat(cache.getOrSet("cache", "lazy", String.class, loader, CacheOptions.defaults())).isEqualTo("value-1");
        assertThat(cache.getOrSet("cache", "lazy", String.class, loader, CacheOptions.defaults())).isEqualTo("value-1");
        assertThat(loads).hasValue(1);
    }

    @Test
    void getOrSetServesStaleValueWhenReloadFails() {
        CacheOptions options = CacheOptions.builder()
                .ttl(Duration.ofSeconds(30))
                .staleWhileRevalidate(true)
                .build();
        cache.getOrSet("cache", "report", String.class, () -> "v1", options);

        clock.advance(Duration.ofMinutes(1));
        String value = cache.getOrSet("cache", "report", String.class, () -> {
            throw new IllegalStateException("source down");
        }, options);

        assertThat(value).isEqualTo("v1");
    }

    @Test
    void getOrSetPropagatesLoaderFailureWithoutStaleValue() {
        assertThatThrownBy(() -> cache.getOrSet("cache", "fresh", String.class, () -> {
            throw new IllegalStateException("source down");
        }, CacheOptions.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("source down");
    }

    @Test
    void getOrSetLoadsOnceAfterBackingOffFromAHeldLock() {
        backend.tryLock("cache:contended", "other-node", Duration.ofSeconds(5));
        AtomicInteger loads = new AtomicInteger();

        String value = cache.getOrSet("cache", "contended", String.class,
                () -> "value-" + loads.incrementAndGet(), CacheOptions.defaults());

        assertThat(value).isEqualTo("value-1");
        assertThat(loads).hasValue(1);
        assertThat(cache.get("cache", "contended", String.class)).contains("value-1");
    }

    @Test
    void getOrSetUsesValueWrittenByLockHolderWhileBackingOff() {
        InMemoryCacheBackend contended = spy(new InMemoryCacheBackend(objectMapper, clock));
        doAnswer(invocation -> {
            contended.write(CacheEntry.builder()
                    .namespace("cache")
                    .key("contended")
                    .data(objectMapper.valueToTree("from-other-node"))
                    .timestamp(clock.millis())
                    .ttlSeconds(300L)
                    .version(1L)
                    .build(), Duration.ofMinutes(5));
            return false;
        }).when(contended).tryLock(anyString(), anyString(), any(Duration.class));
        TieredCacheService service = newCache(contended);
        AtomicInteger loads = new AtomicInteger();

        String value = service.getOrSet("cache", "contended", String.class,
                () -> "local-" + loads.incrementAndGet(), CacheOptions.defaults());

        assertThat(value).isEqualTo("from-other-node");
        assertThat(loads).hasValue(0);
    }

    @Test
    void warmupLoadsByDescendingPriorityAndSkipsFreshKeys() {
        cache.set("cache", "already", "fresh", CacheOptions.defaults());
        List<String> loadOrder = new ArrayList<>();
        List<WarmupEntry<?>> entries = List.of(
                warmupEntry("low", 1, loadOrder),
                warmupEntry("already", 9, loadOrder),
                warmupEntry("high", 5, loadOrder),
                warmupEntry("mid", 3, loadOrder));

        WarmupResult result = cache.warmup(entries, null);

        assertThat(loadOrder).containsExactly("high", "mid", "low");
        assertThat(result.getSuccess()).isEqualTo(3);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(result.getFailed()).isZero();
        assertThat(cache.get("cache", "already", String.class)).contains("fresh");
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    void warmupWithIntervalSchedulesRecurringRefresh() {
        List<String> loadOrder = new ArrayList<>();
        Duration every = Duration.ofMinutes(5);

        WarmupResult result = cache.warmup(List.of(warmupEntry("report", 1, loadOrder)), every);

        assertThat(result.getSuccess()).isEqualTo(1);
        ArgumentCaptor<Runnable> refresh = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleAtFixedRate(refresh.capture(), eq(clock.instant().plus(every)), eq(every));

        clock.advance(Duration.ofHours(2));
        refresh.getValue().run();

        assertThat(loadOrder).containsExactly("report", "report");
    }

    @Test
    void failedWarmupLoaderIsCountedAndDoesNotStopTheRest() {
        List<String> loadOrder = new ArrayList<>();
        WarmupEntry<String> broken = WarmupEntry.<String>builder()
                .namespace("cache")
                .key("broken")
                .type(String.class)
                .loader(() -> {
                    throw new IllegalStateException("source down");
                })
                .priority(10)
                .build();

        WarmupResult result = cache.warmup(List.of(broken, warmupEntry("ok", 1, loadOrder)), null);

        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getSuccess()).isEqualTo(1);
        assertThat(loadOrder).containsExactly("ok");
    }

    @Test
    void healthCheckWritesAndReadsEveryNamespace() {
        CacheHealth health = cache.healthCheck();

        assertThat(health.getStatus()).isEqualTo(CacheHealth.Status.HEALTHY);
        assertThat(health.getDetails()).containsKeys("cache", "rate_limit", "users", "analytics");
    }
}
