package com.example.collab.session.service;

import com.example.collab.session.dto.CollaborationPayload;
import com.example.collab.session.frame.FrameFactory;
import com.example.collab.session.frame.InboundFrame;
import com.example.collab.session.frame.OutboundFrame;
import com.example.collab.session.frame.OutboundType;
import com.example.collab.session.model.Connection;
import com.example.collab.session.model.SessionEvent;
import com.example.collab.session.model.SessionEventType;
import com.example.collab.shared.exception.CollabException;
import com.example.collab.shared.exception.StorageException;
import com.example.collab.shared.quota.QuotaDecision;
import com.example.collab.shared.quota.QuotaLimits;
import com.example.collab.shared.quota.QuotaPeriod;
import com.example.collab.shared.quota.QuotaRequest;
import com.example.collab.shared.quota.QuotaService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Handles inbound frames for one connection, in receipt order, on the connection's session key.
 * Every frame is charged against the {@code websocket_messages} quota before it is routed.
 */
@Service
@Slf4j
public class MessageDispatcher {

    private static final long DEFAULT_MESSAGE_LIMIT = 60;

    private final SessionCoordinator sessionCoordinator;
    private final RoomCoordinator roomCoordinator;
    private final ConnectionRegistry connectionRegistry;
    private final HeartbeatMonitor heartbeatMonitor;
    private final QuotaService quotaService;
    private final QuotaLimits quotaLimits;
    private final SessionEventLog eventLog;
    private final FrameFactory frameFactory;
    private final KeyedSequencer sequencer;
    private final CoordinatorMetrics coordinatorMetrics;
    private final Clock clock;

    public MessageDispatcher(SessionCoordinator sessionCoordinator,
                             RoomCoordinator roomCoordinator,
                             ConnectionRegistry connectionRegistry,
                             HeartbeatMonitor heartbeatMonitor,
                             QuotaService quotaService,
                             QuotaLimits quotaLimits,
                             SessionEventLog eventLog,
                             FrameFactory frameFactory,
                             KeyedSequencer sequencer,
                             CoordinatorMetrics coordinatorMetrics,
                             Clock clock) {
        this.sessionCoordinator = sessionCoordinator;
        this.roomCoordinator = roomCoordinator;
        this.connectionRegistry = connectionRegistry;
        this.heartbeatMonitor = heartbeatMonitor;
        this.quotaService = quotaService;
        this.quotaLimits = quotaLimits;
        this.eventLog = eventLog;
        this.frameFactory = frameFactory;
        this.sequencer = sequencer;
        this.coordinatorMetrics = coordinatorMetrics;
        this.clock = clock;
    }

    public void dispatch(Connection connection, String text) {
        sequencer.run(KeyedSequencer.sessionKey(connection.getSessionId()), () -> handle(connection, text));
    }

    private void handle(Connection connection, String text) {
        if (!connection.isActive()) {
            return;
        }
        InboundFrame frame;
        try {
            frame = frameFactory.parse(text);
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable frame on connection {}: {}", connection.getId(), e.getMessage());
            connectionRegistry.send(connection, frameFactory.error("Invalid message format"));
            return;
        }

        connection.setLastActivityAt(clock.millis());
        try {
            sessionCoordinator.touch(connection.getSessionId());
        } catch (StorageException e) {
            log.warn("Could not record activity for session {}: {}", connection.getSessionId(), e.getMessage());
        }

        QuotaDecision decision = quotaService.checkAndConsume(QuotaRequest.builder()
                .identifier(connection.getRateLimitKey())
                .quotaType(QuotaLimits.WEBSOCKET_MESSAGES)
                .amount(1)
                .customLimit(messageLimit(connection))
                .customPeriod(QuotaPeriod.MINUTE)
                .build());
        if (!decision.isAllowed()) {
            coordinatorMetrics.messageRateLimited();
            connectionRegistry.send(connection, frameFactory.rateLimited(decision.getRetryAfterMs()));
            return;
        }
        coordinatorMetrics.messageAccepted();

        try {
            route(connection, frame);
        } catch (CollabException | IllegalArgumentException e) {
            connectionRegistry.send(connection, frameFactory.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Error handling {} frame on connection {}", frame.getType().value(), connection.getId(), e);
            coordinatorMetrics.error("websocket");
            connectionRegistry.send(connection, frameFactory.error("Internal error"));
        }
    }

    private void route(Connection connection, InboundFrame frame) {
        switch (frame.getType()) {
            case DATA:
                handleData(connection, frame);
                break;
            case PING:
            case HEARTBEAT:
                heartbeatMonitor.pongReceived(connection);
                connectionRegistry.send(connection, frameFactory.pong());
                break;
            case PONG:
                heartbeatMonitor.pongReceived(connection);
                break;
            case JOIN_ROOM:
                handleJoinRoom(connection, frame);
                break;
            case LEAVE_ROOM:
                handleLeaveRoom(connection, frame);
                break;
            case COLLABORATION:
                roomCoordinator.applyCollaboration(connection, frameFactory.payload(frame, CollaborationPayload.class));
                break;
            case UNKNOWN:
            default:
                log.warn("Unknown message type on connection {}", connection.getId());
                connectionRegistry.send(connection, frameFactory.error("Unknown message type"));
                break;
        }
    }

    /**
     * Relays to every room the connection is in, or to the rest of the session when it is in none.
     * The sender never receives its own frame.
     */
    private void handleData(Connection connection, InboundFrame frame) {
        OutboundFrame relay = OutboundFrame.builder()
                .type(OutboundType.DATA)
                .data(frameFactory.toPlain(frame.getData()))
                .connectionId(connection.getId())
                .userId(connection.getOwnerUserId())
                .sessionId(connection.getSessionId())
                .timestamp(clock.millis())
                .build();
        Set<String> roomIds = Set.copyOf(connection.getRoomIds());
        if (roomIds.isEmpty()) {
            sessionCoordinator.broadcastToSession(connection.getSessionId(), relay, connection.getId());
        } else {
            for (String roomId : roomIds) {
                roomCoordinator.broadcast(roomId, relay, connection.getId());
            }
        }

        Map<String, Object> details = new HashMap<>();
        JsonNode data = frame.getData();
        details.put("messageType", data != null && data.hasNonNull("type") ? data.get("type").asText() : null);
        eventLog.append(SessionEvent.builder()
                .type(SessionEventType.DATA_MESSAGE)
                .sessionId(connection.getSessionId())
                .userId(connection.getOwnerUserId())
                .connectionId(connection.getId())
                .timestamp(clock.millis())
                .data(details)
                .build());
    }

    private void handleJoinRoom(Connection connection, InboundFrame frame) {
        String roomId = frame.dataText("roomId");
        if (roomId == null || roomId.isBlank()) {
            connectionRegistry.send(connection, frameFactory.error("Room ID required"));
            return;
        }
        roomCoordinator.join(roomId, connection);
        sessionCoordinator.recordRoomMembership(connection.getSessionId(), roomId, true);
        connectionRegistry.send(connection, frameFactory.roomJoined(roomId));
    }

    private void handleLeaveRoom(Connection connection, InboundFrame frame) {
        String roomId = frame.dataText("roomId");
        if (roomId == null || roomId.isBlank()) {
            connectionRegistry.send(connection, frameFactory.error("Room ID required"));
            return;
        }
        roomCoordinator.leave(roomId, connection.getId());
        sessionCoordinator.recordRoomMembership(connection.getSessionId(), roomId, false);
        connectionRegistry.send(connection, frameFactory.roomLeft(roomId));
    }

    private long messageLimit(Connection connection) {
        return quotaLimits.find(QuotaLimits.WEBSOCKET_MESSAGES, QuotaPeriod.MINUTE)
                .map(limit -> limit.limitFor(connection.getSubscriptionTier()))
                .orElse(DEFAULT_MESSAGE_LIMIT);
    }
}
