package com.example.collab.session.service;

import com.example.collab.session.dto.CreateSessionRequest;
import com.example.collab.session.dto.UpdateSessionRequest;
import com.example.collab.session.frame.FrameFactory;
import com.example.collab.session.frame.OutboundFrame;
import com.example.collab.session.frame.OutboundType;
import com.example.collab.session.model.CollaborationState;
import com.example.collab.session.model.Connection;
import com.example.collab.session.model.ConnectionRef;
import com.example.collab.session.model.ConnectionState;
import com.example.collab.session.model.RateLimitState;
import com.example.collab.session.model.SecurityState;
import com.example.collab.session.model.Session;
import com.example.collab.session.model.SessionEvent;
import com.example.collab.session.model.SessionEventType;
import com.example.collab.session.repository.SessionRepository;
import com.example.collab.session.websocket.FrameChannel;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.exception.ResourceConflictException;
import com.example.collab.shared.exception.ResourceNotFoundException;
import com.example.collab.shared.exception.UnauthorizedException;
import com.example.collab.shared.quota.UserTierResolver;
import com.example.collab.shared.user.SubscriptionTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns session state and the connections bound to it. All session mutations run on the
 * session's sequencer key; room work is nested inside it, never the other way round.
 */
@Service
@Slf4j
public class SessionCoordinator {

    public static final int NORMAL_CLOSURE = 1000;
    public static final String REASON_STALE = "Connection stale";
    public static final String REASON_ADMIN = "Disconnected by admin";
    public static final String REASON_SESSION_DELETED = "Session deleted";
    public static final String REASON_INACTIVE = "Connection inactive";

    private final SessionRepository sessionRepository;
    private final RoomCoordinator roomCoordinator;
    private final ConnectionRegistry connectionRegistry;
    private final HeartbeatMonitor heartbeatMonitor;
    private final SessionEventLog eventLog;
    private final FrameFactory frameFactory;
    private final KeyedSequencer sequencer;
    private final UserTierResolver tierResolver;
    private final CoordinatorMetrics coordinatorMetrics;
    private final AppProperties appProperties;
    private final Clock clock;

    public SessionCoordinator(SessionRepository sessionRepository,
                              RoomCoordinator roomCoordinator,
                              ConnectionRegistry connectionRegistry,
                              HeartbeatMonitor heartbeatMonitor,
                              SessionEventLog eventLog,
                              FrameFactory frameFactory,
                              KeyedSequencer sequencer,
                              UserTierResolver tierResolver,
                              CoordinatorMetrics coordinatorMetrics,
                              AppProperties appProperties,
                              Clock clock) {
        this.sessionRepository = sessionRepository;
        this.roomCoordinator = roomCoordinator;
        this.connectionRegistry = connectionRegistry;
        this.heartbeatMonitor = heartbeatMonitor;
        this.eventLog = eventLog;
        this.frameFactory = frameFactory;
        this.sequencer = sequencer;
        this.tierResolver = tierResolver;
        this.coordinatorMetrics = coordinatorMetrics;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public Session createSession(String sessionId, String userId, CreateSessionRequest request,
                                 String ipAddress, String userAgent) {
        requireId(sessionId);
        CreateSessionRequest body = request != null ? request : new CreateSessionRequest();
        return sequencer.call(KeyedSequencer.sessionKey(sessionId), () -> {
            if (findActive(sessionId).isPresent()) {
                throw new ResourceConflictException("Session already exists: " + sessionId);
            }
            return newSession(sessionId, userId, body, ipAddress, userAgent);
        });
    }

    /**
     * Returns the session, deleting it first if it has expired.
     */
    public Optional<Session> findSession(String sessionId) {
        requireId(sessionId);
        return sequencer.call(KeyedSequencer.sessionKey(sessionId), () -> findActive(sessionId));
    }

    /**
     * Session as seen by {@code requestingUserId}. Rate limit and security state are only shown
     * to the owner.
     */
    public Session getSession(String sessionId, String requestingUserId) {
        Session session = findSession(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session not found"));
        if (session.getOwnerUserId() != null && !session.getOwnerUserId().equals(requestingUserId)) {
            return session.toBuilder()
                    .rateLimitState(null)
                    .securityState(null)
                    .build();
        }
        return session;
    }

    public Session updateSession(String sessionId, UpdateSessionRequest request, String requestingUserId) {
        requireId(sessionId);
        return sequencer.call(KeyedSequencer.sessionKey(sessionId), () -> {
            Session session = findActive(sessionId)
                    .orElseThrow(() -> new ResourceNotFoundException("Session not found"));
            requireOwner(session, requestingUserId, "update");

            long now = clock.millis();
            List<String> updatedFields = new ArrayList<>();
            if (request.getData() != null) {
                session.getData().putAll(request.getData());
                updatedFields.add("data");
            }
            if (request.getMetadata() != null) {
                session.getMetadata().putAll(request.getMetadata());
                updatedFields.add("metadata");
            }
            if (request.getPersistent() != null) {
                session.setPersistent(request.getPersistent());
                updatedFields.add("persistent");
            }
            if (request.getTtl() != null) {
                session.setExpiresAt(now + request.getTtl());
                updatedFields.add("ttl");
            }
            session.touch(now);
            sessionRepository.save(session);
            logEvent(SessionEventType.SESSION_UPDATED, sessionId, requestingUserId, null, Map.of("updatedFields", updatedFields));
            return session;
        });
    }

    /**
     * Closes every connection of the session, removes them from their rooms and deletes the session.
     */
    public void deleteSession(String sessionId, String requestingUserId) {
        requireId(sessionId);
        sequencer.run(KeyedSequencer.sessionKey(sessionId), () -> {
            Session session = findActive(sessionId)
                    .orElseThrow(() -> new ResourceNotFoundException("Session not found"));
            requireOwner(session, requestingUserId, "delete");
            removeSession(session, requestingUserId);
        });
    }

    /**
     * Binds a new connection to the session, recreating the session if it vanished since the
     * upgrade was accepted. Sends the handshake, joins {@code roomId} when given and starts the
     * heartbeat.
     */
    public Connection openConnection(String sessionId, String userId, String roomId,
                                     Map<String, String> metadata, FrameChannel channel) {
        requireId(sessionId);
        Map<String, String> connectionMetadata = metadata != null ? metadata : Map.of();
        return sequencer.call(KeyedSequencer.sessionKey(sessionId), () -> {
            Session session = findActive(sessionId).orElseGet(() -> newSession(sessionId, userId,
                    new CreateSessionRequest(), connectionMetadata.get("ip"), connectionMetadata.get("userAgent")));

            SubscriptionTier tier = session.getRateLimitState() != null && session.getRateLimitState().getTier() != null
                    ? session.getRateLimitState().getTier()
                    : tierResolver.resolveTier(userId);
            long now = clock.millis();
            Connection connection = new Connection(UUID.randomUUID().toString(), sessionId, userId, now, connectionMetadata, tier, channel);

            session.getConnections().add(connection.toRef());
            session.touch(now);
            sessionRepository.save(session);

            connection.setState(ConnectionState.ACTIVE);
            connectionRegistry.register(connection);
            connectionRegistry.send(connection, frameFactory.connected(connection.getId(), sessionId, userId != null));

            if (roomId != null && !roomId.isBlank()) {
                try {
                    roomCoordinator.join(roomId, connection);
                    recordRoomMembership(sessionId, roomId, true);
                    connectionRegistry.send(connection, frameFactory.roomJoined(roomId));
                } catch (RuntimeException e) {
                    log.warn("Connection {} could not join room {} on connect: {}", connection.getId(), roomId, e.getMessage());
                    connectionRegistry.send(connection, frameFactory.error(e.getMessage()));
                }
            }

            heartbeatMonitor.start(connection, this::disconnectStale);
            broadcastToSession(sessionId, frameFactory.sessionPresence(OutboundType.USER_JOINED, connection.getId()), connection.getId());
            logEvent(SessionEventType.USER_CONNECTED, sessionId, userId, connection.getId(), null);
            log.info("Connection {} opened for session {} (user {}, tier {})", connection.getId(), sessionId, userId, tier.value());
            return connection;
        });
    }

    /**
     * Tears down a connection: leaves its rooms, detaches it from the session and deletes the
     * session if it is now empty and not persistent. Closing an already closed connection is a no-op.
     */
    public void closeConnection(Connection connection, Integer code, String reason) {
        sequencer.run(KeyedSequencer.sessionKey(connection.getSessionId()), () -> {
            if (connectionRegistry.remove(connection.getId()).isEmpty()) {
                return;
            }
            connection.setState(ConnectionState.CLOSED);
            heartbeatMonitor.stop(connection);
            leaveRooms(connection.getId(), Set.copyOf(connection.getRoomIds()));

            Map<String, Object> details = new HashMap<>();
            details.put("code", code);
            details.put("reason", reason);
            logEvent(SessionEventType.USER_DISCONNECTED, connection.getSessionId(), connection.getOwnerUserId(), connection.getId(), details);

            Optional<Session> found = findActive(connection.getSessionId());
            if (found.isEmpty()) {
                return;
            }
            Session session = found.get();
            session.getConnections().removeIf(ref -> ref.getConnectionId().equals(connection.getId()));
            if (session.getCollaborationState() != null) {
                syncCollaboration(session);
            }
            session.touch(clock.millis());
            if (session.getConnections().isEmpty() && !session.isPersistent()) {
                removeSession(session, connection.getOwnerUserId());
                return;
            }
            sessionRepository.save(session);
            broadcastToSession(session.getId(), frameFactory.sessionPresence(OutboundType.USER_LEFT, connection.getId()), connection.getId());
            log.info("Connection {} closed for session {} ({} {})", connection.getId(), session.getId(), code, reason);
        });
    }

    /**
     * Closes the socket with status 1000 and the given reason, then tears the connection down.
     *
     * @return false if no such connection is live on this instance
     */
    public boolean forceDisconnect(String connectionId, String reason) {
        Optional<Connection> found = connectionRegistry.find(connectionId);
        if (found.isEmpty()) {
            return false;
        }
        Connection connection = found.get();
        heartbeatMonitor.stop(connection);
        connection.getChannel().close(NORMAL_CLOSURE, reason);
        closeConnection(connection, NORMAL_CLOSURE, reason);
        return true;
    }

    /**
     * Closes the socket right away and queues the teardown on the session's key, off the timer thread.
     */
    public void disconnectStale(Connection connection) {
        connection.getChannel().close(NORMAL_CLOSURE, REASON_STALE);
        sequencer.submit(KeyedSequencer.sessionKey(connection.getSessionId()), () -> {
            closeConnection(connection, NORMAL_CLOSURE, REASON_STALE);
            return null;
        }).exceptionally(e -> {
            log.error("Teardown of stale connection {} failed: {}", connection.getId(), e.getMessage());
            return null;
        });
    }

    public void touch(String sessionId) {
        sequencer.run(KeyedSequencer.sessionKey(sessionId), () -> findActive(sessionId).ifPresent(session -> {
            session.touch(clock.millis());
            sessionRepository.save(session);
        }));
    }

    public void recordRoomMembership(String sessionId, String roomId, boolean joined) {
        sequencer.run(KeyedSequencer.sessionKey(sessionId), () -> findActive(sessionId).ifPresent(session -> {
            CollaborationState state = session.getCollaborationState();
            if (state == null) {
                state = new CollaborationState();
                session.setCollaborationState(state);
            }
            if (joined && !state.getRoomIds().contains(roomId)) {
                state.getRoomIds().add(roomId);
            } else if (!joined) {
                syncCollaboration(session);
            }
            state.setActiveCount(state.getRoomIds().size());
            state.setLastCollaborationAt(clock.millis());
            sessionRepository.save(session);
        }));
    }

    /**
     * Deletes a room, then drops it from the collaboration state of every session that had a
     * connection in it. Sessions are updated after the room lock is released.
     */
    public void deleteRoom(String roomId, String requestingUserId) {
        Set<String> affectedSessions = roomCoordinator.deleteRoom(roomId, requestingUserId);
        affectedSessions.forEach(sessionId -> recordRoomMembership(sessionId, roomId, false));
    }

    public int broadcastToSession(String sessionId, OutboundFrame frame, String excludeConnectionId) {
        List<String> connectionIds = connectionRegistry.forSession(sessionId).stream()
                .map(Connection::getId)
                .collect(Collectors.toList());
        return connectionRegistry.sendAll(connectionIds, frame, excludeConnectionId);
    }

    /**
     * Deletes every session past its expiry.
     *
     * @return number of sessions removed
     */
    public int expireSessions() {
        int expired = 0;
        for (String sessionId : sessionRepository.findAllIds()) {
            try {
                boolean removed = sequencer.call(KeyedSequencer.sessionKey(sessionId), () -> {
                    Optional<Session> session = sessionRepository.findById(sessionId);
                    if (session.isPresent() && session.get().isExpired(clock.millis())) {
                        removeSession(session.get(), null);
                        return true;
                    }
                    return false;
                });
                if (removed) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire session {}: {}", sessionId, e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Cleaned up {} expired sessions", expired);
        }
        return expired;
    }

    /**
     * Closes connections that are no longer active or have been silent past the inactivity timeout.
     */
    public int closeInactiveConnections() {
        long threshold = clock.millis() - appProperties.getSession().getInactivityTimeout().toMillis();
        int closed = 0;
        for (Connection connection : connectionRegistry.all()) {
            if (!connection.isActive() || connection.getLastActivityAt() < threshold) {
                if (forceDisconnect(connection.getId(), REASON_INACTIVE)) {
                    closed++;
                }
            }
        }
        if (closed > 0) {
            log.info("Cleaned up {} inactive connections", closed);
        }
        return closed;
    }

    public long averageSessionDurationMs() {
        long now = clock.millis();
        List<Long> durations = new ArrayList<>();
        for (String sessionId : sessionRepository.findAllIds()) {
            sessionRepository.findById(sessionId).ifPresent(s -> durations.add(now - s.getCreatedAt()));
        }
        return durations.isEmpty() ? 0 : (long) durations.stream().mapToLong(Long::longValue).average().orElse(0);
    }

    public int totalSessions() {
        return sessionRepository.findAllIds().size();
    }

    private Optional<Session> findActive(String sessionId) {
        Optional<Session> session = sessionRepository.findById(sessionId);
        if (session.isPresent() && session.get().isExpired(clock.millis())) {
            log.debug("Session {} expired, removing", sessionId);
            removeSession(session.get(), null);
            return Optional.empty();
        }
        return session;
    }

    private Session newSession(String sessionId, String userId, CreateSessionRequest body, String ipAddress, String userAgent) {
        long now = clock.millis();
        long ttl = body.getTtl() != null ? body.getTtl() : appProperties.getSession().getDefaultTtl().toMillis();
        SubscriptionTier tier = tierResolver.resolveTier(userId);
        Session session = Session.builder()
                .id(sessionId)
                .ownerUserId(userId)
                .ipAddress(ipAddress != null ? ipAddress : "unknown")
                .userAgent(userAgent != null ? userAgent : "unknown")
                .data(body.getSessionData() != null ? new LinkedHashMap<>(body.getSessionData()) : new LinkedHashMap<>())
                .metadata(body.getMetadata() != null ? new LinkedHashMap<>(body.getMetadata()) : new LinkedHashMap<>())
                .persistent(body.isPersistent())
                .createdAt(now)
                .lastAccessedAt(now)
                .expiresAt(now + ttl)
                .rateLimitState(RateLimitState.builder()
                        .tier(tier)
                        .windowStart(now)
                        .customLimits(body.getCustomLimits())
                        .build())
                .collaborationState(CollaborationState.builder().lastCollaborationAt(now).build())
                .securityState(new SecurityState())
                .build();
        sessionRepository.save(session);
        coordinatorMetrics.sessionCreated();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ttl", ttl);
        details.put("tier", tier.value());
        logEvent(SessionEventType.SESSION_CREATED, sessionId, userId, null, details);
        log.info("Session {} created for user {} (tier {}, ttl {} ms)", sessionId, userId, tier.value(), ttl);
        return session;
    }

    private void removeSession(Session session, String requestingUserId) {
        Set<String> connectionIds = session.getConnections().stream()
                .map(ConnectionRef::getConnectionId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> roomIds = new LinkedHashSet<>();
        if (session.getCollaborationState() != null) {
            roomIds.addAll(session.getCollaborationState().getRoomIds());
        }

        for (Connection connection : connectionRegistry.forSession(session.getId())) {
            connectionIds.add(connection.getId());
            roomIds.addAll(connection.getRoomIds());
            connectionRegistry.remove(connection.getId());
            connection.setState(ConnectionState.CLOSED);
            heartbeatMonitor.stop(connection);
            connection.getChannel().close(NORMAL_CLOSURE, REASON_SESSION_DELETED);
        }
        for (String connectionId : connectionIds) {
            leaveRooms(connectionId, roomIds);
        }

        sessionRepository.delete(session.getId());
        logEvent(SessionEventType.SESSION_DELETED, session.getId(), requestingUserId, null, null);
        log.info("Session {} deleted, {} connections closed", session.getId(), connectionIds.size());
    }

    private void leaveRooms(String connectionId, Set<String> roomIds) {
        for (String roomId : roomIds) {
            try {
                roomCoordinator.leave(roomId, connectionId);
            } catch (RuntimeException e) {
                log.warn("Connection {} could not leave room {}: {}", connectionId, roomId, e.getMessage());
            }
        }
    }

    /**
     * Rebuilds the session's room list from the rooms its live connections are still in.
     */
    private void syncCollaboration(Session session) {
        CollaborationState state = session.getCollaborationState();
        Set<String> stillJoined = connectionRegistry.forSession(session.getId()).stream()
                .flatMap(c -> c.getRoomIds().stream())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        state.getRoomIds().retainAll(stillJoined);
        state.setActiveCount(state.getRoomIds().size());
    }

    private static void requireOwner(Session session, String requestingUserId, String action) {
        if (session.getOwnerUserId() != null && !session.getOwnerUserId().equals(requestingUserId)) {
            throw new UnauthorizedException("Unauthorized to " + action + " session");
        }
    }

    private static void requireId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID required");
        }
    }

    private void logEvent(SessionEventType type, String sessionId, String userId, String connectionId, Map<String, Object> data) {
        eventLog.append(SessionEvent.builder()
                .type(type)
                .sessionId(sessionId)
                .userId(userId)
                .connectionId(connectionId)
                .timestamp(clock.millis())
                .data(data)
                .build());
    }
}
