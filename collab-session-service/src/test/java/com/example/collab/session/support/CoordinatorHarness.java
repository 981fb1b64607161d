package com.example.collab.session.support;

import com.example.collab.session.frame.FrameFactory;
import com.example.collab.session.model.Connection;
import com.example.collab.session.model.ConnectionState;
import com.example.collab.session.repository.RoomRepository;
import com.example.collab.session.repository.SessionRepository;
import com.example.collab.session.service.ConnectionRegistry;
import com.example.collab.session.service.CoordinatorMetrics;
import com.example.collab.session.service.HeartbeatMonitor;
import com.example.collab.session.service.KeyedSequencer;
import com.example.collab.session.service.MessageDispatcher;
import com.example.collab.session.service.PermissionPolicy;
import com.example.collab.session.service.RoomCoordinator;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.service.SessionEventLog;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.config.MonitoringConfig;
import com.example.collab.shared.quota.QuotaDecision;
import com.example.collab.shared.quota.QuotaLimits;
import com.example.collab.shared.quota.QuotaService;
import com.example.collab.shared.quota.UserTierResolver;
import com.example.collab.shared.store.InMemoryDurableStore;
import com.example.collab.shared.user.SubscriptionTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.core.task.support.TaskExecutorAdapter;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The coordinator object graph wired by hand over in-memory stores, a controllable clock, a
 * virtual-time heartbeat scheduler and a sequencer that runs submitted work inline.
 */
public class CoordinatorHarness {

    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
    public final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    public final AppProperties appProperties = new AppProperties();
    public final InMemoryDurableStore store = new InMemoryDurableStore(objectMapper, clock);
    public final FrameFactory frameFactory = new FrameFactory(objectMapper, clock);
    public final CoordinatorMetrics metrics =
            new CoordinatorMetrics(new MonitoringConfig.CollabMetricsCollector(new SimpleMeterRegistry()));
    public final ConnectionRegistry registry = new ConnectionRegistry(frameFactory, metrics);
    public final KeyedSequencer sequencer = new KeyedSequencer(new TaskExecutorAdapter(Runnable::run));
    public final SessionEventLog eventLog = new SessionEventLog(store, clock);
    public final SessionRepository sessionRepository = new SessionRepository(store);
    public final RoomRepository roomRepository = new RoomRepository(store);
    public final VirtualTimeScheduler heartbeatScheduler = VirtualTimeScheduler.create();
    public final UserTierResolver tierResolver = mock(UserTierResolver.class);
    public final QuotaService quotaService = mock(QuotaService.class);

    public final RoomCoordinator rooms;
    public final HeartbeatMonitor heartbeat;
    public final SessionCoordinator sessions;
    public final MessageDispatcher dispatcher;

    public CoordinatorHarness() {
        when(tierResolver.resolveTier(any())).thenReturn(SubscriptionTier.FREE);
        allowAllMessages();
        rooms = new RoomCoordinator(roomRepository, registry, new PermissionPolicy(), eventLog,
                frameFactory, sequencer, appProperties, clock);
        heartbeat = new HeartbeatMonitor(registry, frameFactory, heartbeatScheduler, clock, appProperties);
        sessions = new SessionCoordinator(sessionRepository, rooms, registry, heartbeat, eventLog,
                frameFactory, sequencer, tierResolver, metrics, appProperties, clock);
        dispatcher = new MessageDispatcher(sessions, rooms, registry, heartbeat, quotaService, new QuotaLimits(),
                eventLog, frameFactory, sequencer, metrics, clock);
    }

    public void allowAllMessages() {
        when(quotaService.checkAndConsume(any())).thenReturn(QuotaDecision.builder()
                .allowed(true)
                .remaining(59)
                .limit(60)
                .reason(QuotaDecision.Reason.OK)
                .build());
    }

    /**
     * A live connection registered directly, without a session, for room-level tests.
     */
    public Connection registeredConnection(String sessionId, String userId, RecordingFrameChannel channel) {
        Connection connection = new Connection(UUID.randomUUID().toString(), sessionId, userId, clock.millis(),
                Map.of(), SubscriptionTier.FREE, channel);
        connection.setState(ConnectionState.ACTIVE);
        registry.register(connection);
        return connection;
    }
}
