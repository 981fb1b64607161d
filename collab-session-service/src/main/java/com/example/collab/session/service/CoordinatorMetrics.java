package com.example.collab.session.service;

import com.example.collab.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Coordinator counters, exposed on the health and stats endpoints and mirrored to Micrometer.
 */
@Component
@RequiredArgsConstructor
public class CoordinatorMetrics {

    private final MonitoringConfig.CollabMetricsCollector metricsCollector;

    private final LongAdder sessionsCreated = new LongAdder();
    private final LongAdder totalConnections = new LongAdder();
    private final LongAdder totalMessages = new LongAdder();
    private final LongAdder rateLimitedMessages = new LongAdder();
    private final LongAdder totalErrors = new LongAdder();
    private final AtomicLong peakConnections = new AtomicLong();
    private final AtomicLong averageSessionDurationMs = new AtomicLong();

    public void sessionCreated() {
        sessionsCreated.increment();
        metricsCollector.incrementCounter("collab.sessions.created");
    }

    public void connectionOpened(int activeNow) {
        totalConnections.increment();
        peakConnections.accumulateAndGet(activeNow, Math::max);
        metricsCollector.setGauge("collab.connections.active", activeNow);
    }

    public void connectionClosed(int activeNow) {
        metricsCollector.setGauge("collab.connections.active", activeNow);
    }

    public void messageAccepted() {
        totalMessages.increment();
        metricsCollector.incrementCounter("collab.messages.received", "status", "accepted");
    }

    public void messageRateLimited() {
        totalMessages.increment();
        rateLimitedMessages.increment();
        metricsCollector.incrementCounter("collab.messages.received", "status", "rate_limited");
    }

    public void error(String type) {
        totalErrors.increment();
        metricsCollector.incrementCounter("collab.errors", "type", type);
    }

    public void refresh(long averageSessionDuration, int activeConnections) {
        averageSessionDurationMs.set(averageSessionDuration);
        peakConnections.accumulateAndGet(activeConnections, Math::max);
        metricsCollector.setGauge("collab.sessions.average_duration_ms", averageSessionDuration);
    }

    public long getPeakConnections() {
        return peakConnections.get();
    }

    public long getAverageSessionDurationMs() {
        return averageSessionDurationMs.get();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("totalSessionsCreated", sessionsCreated.sum());
        snapshot.put("totalConnections", totalConnections.sum());
        snapshot.put("totalMessages", totalMessages.sum());
        snapshot.put("rateLimitedMessages", rateLimitedMessages.sum());
        snapshot.put("totalErrors", totalErrors.sum());
        snapshot.put("peakConnections", peakConnections.get());
        snapshot.put("averageSessionDurationMs", averageSessionDurationMs.get());
        return snapshot;
    }
}
