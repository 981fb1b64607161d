package com.example.collab.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the coordinator, quota and cache layers.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder collabMetrics() {
        return registry -> {
            registry.counter("collab.sessions.created");
            registry.counter("collab.messages.received", "status", "accepted");
            registry.counter("collab.messages.received", "status", "rate_limited");
            registry.counter("collab.quota.checks", "reason", "ok");
            registry.counter("collab.quota.checks", "reason", "quota_exceeded");
            registry.counter("collab.quota.checks", "reason", "fail_open_on_error");

            Timer.builder("collab.cache.latency")
                    .description("Round trip to the remote cache tier")
                    .tag("operation", "read")
                    .register(registry);
            Timer.builder("collab.cache.latency")
                    .description("Round trip to the remote cache tier")
                    .tag("operation", "write")
                    .register(registry);

            registry.counter("collab.errors", "type", "storage");
            registry.counter("collab.errors", "type", "cache");
            registry.counter("collab.errors", "type", "websocket");
        };
    }

    @Bean
    public CollabMetricsCollector collabMetricsCollector(MeterRegistry registry) {
        return new CollabMetricsCollector(registry);
    }

    public static class CollabMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public CollabMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            counters.computeIfAbsent(key(name, tags), k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            timers.computeIfAbsent(key(name, tags), k -> Timer.builder(name).tags(tags).register(registry))
                    .record(durationMs, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, double value, String... tags) {
            AtomicLong gauge = gauges.computeIfAbsent(key(name, tags), k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set((long) value);
        }

        public long getCounterValue(String name, String... tags) {
            Counter counter = counters.get(key(name, tags));
            return counter != null ? (long) counter.count() : 0;
        }

        private static String key(String name, String... tags) {
            return name + "_" + String.join("_", tags);
        }
    }
}
