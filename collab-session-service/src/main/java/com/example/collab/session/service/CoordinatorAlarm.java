package com.example.collab.session.service;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.store.DurableStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic coordinator maintenance. The next fire time is kept as a durable alarm so a restarted
 * instance resumes the existing cadence instead of starting a new one.
 */
@Component
@Slf4j
public class CoordinatorAlarm {

    static final String ALARM_NAME = "coordinator-maintenance";

    private final SessionCoordinator sessionCoordinator;
    private final ConnectionRegistry connectionRegistry;
    private final CoordinatorMetrics coordinatorMetrics;
    private final DurableStore store;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration interval;

    private ScheduledFuture<?> schedule;

    public CoordinatorAlarm(SessionCoordinator sessionCoordinator,
                            ConnectionRegistry connectionRegistry,
                            CoordinatorMetrics coordinatorMetrics,
                            DurableStore store,
                            TaskScheduler taskScheduler,
                            Clock clock,
                            AppProperties appProperties) {
        this.sessionCoordinator = sessionCoordinator;
        this.connectionRegistry = connectionRegistry;
        this.coordinatorMetrics = coordinatorMetrics;
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.interval = appProperties.getSession().getAlarmInterval();
    }

    @PostConstruct
    public void init() {
        Instant now = clock.instant();
        Instant firstRun = store.getAlarm(ALARM_NAME)
                .filter(fireAt -> fireAt.isAfter(now))
                .orElse(now.plus(interval));
        store.setAlarm(ALARM_NAME, firstRun);
        schedule = taskScheduler.scheduleAtFixedRate(this::fire, firstRun, interval);
        log.info("Coordinator maintenance scheduled every {} starting {}", interval, firstRun);
    }

    @PreDestroy
    public void shutdown() {
        if (schedule != null) {
            schedule.cancel(false);
        }
    }

    void fire() {
        try {
            runMaintenance();
        } catch (Exception e) {
            log.error("Coordinator maintenance failed.", e);
        } finally {
            try {
                store.setAlarm(ALARM_NAME, clock.instant().plus(interval));
            } catch (RuntimeException e) {
                log.warn("Could not record next maintenance alarm: {}", e.getMessage());
            }
        }
    }

    /**
     * Expires sessions, closes inactive connections and refreshes the derived metrics.
     */
    public Map<String, Object> runMaintenance() {
        int expiredSessions = sessionCoordinator.expireSessions();
        int closedConnections = sessionCoordinator.closeInactiveConnections();
        long averageDuration = sessionCoordinator.averageSessionDurationMs();
        coordinatorMetrics.refresh(averageDuration, connectionRegistry.activeCount());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("expiredSessions", expiredSessions);
        result.put("closedConnections", closedConnections);
        result.put("averageSessionDurationMs", averageDuration);
        log.debug("Coordinator maintenance: {}", result);
        return result;
    }
}
