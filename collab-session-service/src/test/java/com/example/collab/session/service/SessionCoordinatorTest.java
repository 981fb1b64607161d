package com.example.collab.session.service;

import com.example.collab.session.dto.CreateRoomRequest;
import com.example.collab.session.dto.CreateSessionRequest;
import com.example.collab.session.dto.UpdateSessionRequest;
import com.example.collab.session.model.Connection;
import com.example.collab.session.model.ConnectionState;
import com.example.collab.session.model.Session;
import com.example.collab.session.support.CoordinatorHarness;
import com.example.collab.session.support.RecordingFrameChannel;
import com.example.collab.shared.exception.ResourceConflictException;
import com.example.collab.shared.exception.ResourceNotFoundException;
import com.example.collab.shared.exception.UnauthorizedException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionCoordinatorTest {

    private CoordinatorHarness harness;
    private SessionCoordinator sessions;

    @BeforeEach
    void setUp() {
        harness = new CoordinatorHarness();
        sessions = harness.sessions;
    }

    @Test
    void createSessionUsesDefaultsAndRejectsDuplicates() {
        Session session = sessions.createSession("s1", "alice", null, "203.0.113.9", "junit");

        assertThat(session.getOwnerUserId()).isEqualTo("alice");
        assertThat(session.getExpiresAt() - session.getCreatedAt()).isEqualTo(Duration.ofHours(24).toMillis());
        assertThat(session.getRateLimitState().getTier().value()).isEqualTo("free");
        assertThat(harness.sessionRepository.findById("s1")).isPresent();
        assertThatThrownBy(() -> sessions.createSession("s1", "alice", null, null, null))
                .isInstanceOf(ResourceConflictException.class);
    }

    @Test
    void blankSessionIdIsRejected() {
        assertThatThrownBy(() -> sessions.createSession(" ", "alice", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Session ID required");
    }

    @Test
    void expiredSessionIsRemovedOnRead() {
        sessions.createSession("s1", "alice", CreateSessionRequest.builder().ttl(1_000L).build(), null, null);

        harness.clock.advance(Duration.ofMillis(1_000));
        assertThat(sessions.findSession("s1")).isPresent();

        harness.clock.advance(Duration.ofMillis(1));
        assertThat(sessions.findSession("s1")).isEmpty();
        assertThat(harness.sessionRepository.findById("s1")).isEmpty();
    }

    @Test
    void nonOwnerSeesSessionWithoutPrivateState() {
        sessions.createSession("s1", "alice", null, null, null);

        Session asOwner = sessions.getSession("s1", "alice");
        Session asOther = sessions.getSession("s1", "mallory");

        assertThat(asOwner.getRateLimitState()).isNotNull();
        assertThat(asOwner.getSecurityState()).isNotNull();
        assertThat(asOther.getRateLimitState()).isNull();
        assertThat(asOther.getSecurityState()).isNull();
        assertThatThrownBy(() -> sessions.getSession("missing", "alice")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void updateMergesDataAndChecksOwnership() {
        sessions.createSession("s1", "alice", CreateSessionRequest.builder()
                .sessionData(Map.of("theme", "dark"))
                .build(), null, null);

        Session updated = sessions.updateSession("s1", UpdateSessionRequest.builder()
                .data(Map.of("cursor", 12))
                .persistent(true)
                .build(), "alice");

        assertThat(updated.getData()).containsEntry("theme", "dark").containsEntry("cursor", 12);
        assertThat(updated.isPersistent()).isTrue();
        assertThatThrownBy(() -> sessions.updateSession("s1", new UpdateSessionRequest(), "mallory"))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void anonymousCallerCannotChangeAnOwnedSession() {
        sessions.createSession("s1", "alice", null, null, null);

        assertThatThrownBy(() -> sessions.updateSession("s1", new UpdateSessionRequest(), null))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> sessions.deleteSession("s1", null))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(sessions.findSession("s1")).isPresent();
    }

    @Test
    void deletingARoomDropsItFromSessionCollaborationState() {
        harness.rooms.createRoom("r1", CreateRoomRequest.builder().name("Board").ownerId("alice").build());
        sessions.createSession("s1", "alice", null, null, null);
        RecordingFrameChannel channel = new RecordingFrameChannel();
        sessions.openConnection("s1", "alice", "r1", Map.of(), channel);
        assertThat(harness.sessionRepository.findById("s1").orElseThrow()
                .getCollaborationState().getRoomIds()).containsExactly("r1");

        sessions.deleteRoom("r1", "alice");

        Session session = harness.sessionRepository.findById("s1").orElseThrow();
        assertThat(session.getCollaborationState().getRoomIds()).isEmpty();
        assertThat(session.getCollaborationState().getActiveCount()).isZero();
        assertThat(channel.framesOfType("room_deleted")).hasSize(1);
    }

    @Test
    void openConnectionSendsHandshakeAndRecordsConnection() {
        sessions.createSession("s1", "alice", null, null, null);
        RecordingFrameChannel channel = new RecordingFrameChannel();

        Connection connection = sessions.openConnection("s1", "alice", null, Map.of("ip", "203.0.113.9"), channel);

        JsonNode connected = channel.framesOfType("connected").get(0);
        assertThat(connected.path("connectionId").asText()).isEqualTo(connection.getId());
        assertThat(connected.path("sessionId").asText()).isEqualTo("s1");
        assertThat(connected.path("features").path("collaboration").asBoolean()).isTrue();
        assertThat(connected.path("features").path("authentication").asBoolean()).isTrue();
        assertThat(connected.path("timestamp").asLong()).isEqualTo(harness.clock.millis());
        assertThat(connection.getState()).isEqualTo(ConnectionState.ACTIVE);
        assertThat(harness.sessionRepository.findById("s1").orElseThrow().getConnections())
                .extracting(ref -> ref.getConnectionId())
                .containsExactly(connection.getId());
    }

    @Test
    void openConnectionWithUnknownRoomReportsErrorButStaysConnected() {
        sessions.createSession("s1", "alice", null, null, null);
        RecordingFrameChannel channel = new RecordingFrameChannel();

        Connection connection = sessions.openConnection("s1", "alice", "missing-room", Map.of(), channel);

        assertThat(channel.framesOfType("error")).extracting(f -> f.path("error").asText()).containsExactly("Room not found");
        assertThat(harness.registry.find(connection.getId())).isPresent();
    }

    @Test
    void secondConnectionIsAnnouncedToTheFirst() {
        sessions.createSession("s1", "alice", null, null, null);
        RecordingFrameChannel first = new RecordingFrameChannel();
        sessions.openConnection("s1", "alice", null, Map.of(), first);

        Connection second = sessions.openConnection("s1", "alice", null, Map.of(), new RecordingFrameChannel());

        JsonNode presence = first.framesOfType("data").get(0);
        assertThat(presence.path("data").path("type").asText()).isEqualTo("user_joined");
        assertThat(presence.path("data").path("connectionId").asText()).isEqualTo(second.getId());
    }

    @Test
    void lastDisconnectDeletesNonPersistentSession() {
        sessions.createSession("s1", "alice", null, null, null);
        harness.rooms.createRoom("r1", CreateRoomRequest.builder().ownerId("alice").build());
        Connection connection = sessions.openConnection("s1", "alice", "r1", Map.of(), new RecordingFrameChannel());

        sessions.closeConnection(connection, 1000, "Client closed");

        assertThat(harness.sessionRepository.findById("s1")).isEmpty();
        assertThat(harness.registry.find(connection.getId())).isEmpty();
        assertThat(harness.rooms.findRoom("r1")).isEmpty();
        assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
    }

    @Test
    void persistentSessionOutlivesItsConnections() {
        sessions.createSession("s1", "alice", CreateSessionRequest.builder().persistent(true).build(), null, null);
        Connection connection = sessions.openConnection("s1", "alice", null, Map.of(), new RecordingFrameChannel());

        sessions.closeConnection(connection, 1000, "Client closed");
        sessions.closeConnection(connection, 1000, "Client closed");

        assertThat(harness.sessionRepository.findById("s1")).hasValueSatisfying(s -> assertThat(s.getConnections()).isEmpty());
    }

    @Test
    void closingOneOfTwoConnectionsNotifiesTheOther() {
        sessions.createSession("s1", "alice", null, null, null);
        RecordingFrameChannel stayingChannel = new RecordingFrameChannel();
        sessions.openConnection("s1", "alice", null, Map.of(), stayingChannel);
        Connection leaving = sessions.openConnection("s1", "alice", null, Map.of(), new RecordingFrameChannel());
        stayingChannel.clear();

        sessions.closeConnection(leaving, 1000, "Client closed");

        assertThat(stayingChannel.framesOfType("data"))
                .extracting(f -> f.path("data").path("type").asText())
                .containsExactly("user_left");
        assertThat(harness.sessionRepository.findById("s1")).isPresent();
    }

    @Test
    void deleteSessionClosesEveryConnection() {
        sessions.createSession("s1", "alice", null, null, null);
        RecordingFrameChannel channel = new RecordingFrameChannel();
        sessions.openConnection("s1", "alice", null, Map.of(), channel);

        assertThatThrownBy(() -> sessions.deleteSession("s1", "mallory")).isInstanceOf(UnauthorizedException.class);
        sessions.deleteSession("s1", "alice");

        assertThat(channel.isOpen()).isFalse();
        assertThat(channel.getCloseCode()).isEqualTo(1000);
        assertThat(channel.getCloseReason()).isEqualTo("Session deleted");
        assertThat(harness.registry.all()).isEmpty();
        assertThatThrownBy(() -> sessions.deleteSession("s1", "alice")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void forceDisconnectClosesWithAdminReason() {
        sessions.createSession("s1", "alice", null, null, null);
        RecordingFrameChannel channel = new RecordingFrameChannel();
        Connection connection = sessions.openConnection("s1", "alice", null, Map.of(), channel);

        assertThat(sessions.forceDisconnect(connection.getId(), SessionCoordinator.REASON_ADMIN)).isTrue();
        assertThat(sessions.forceDisconnect(connection.getId(), SessionCoordinator.REASON_ADMIN)).isFalse();
        assertThat(channel.getCloseReason()).isEqualTo("Disconnected by admin");
    }

    @Test
    void maintenanceExpiresSessionsAndClosesSilentConnections() {
        sessions.createSession("short", "bob", CreateSessionRequest.builder().ttl(60_000L).build(), null, null);
        sessions.createSession("s1", "alice", CreateSessionRequest.builder().persistent(true).build(), null, null);
        RecordingFrameChannel channel = new RecordingFrameChannel();
        sessions.openConnection("s1", "alice", null, Map.of(), channel);

        harness.clock.advance(Duration.ofMinutes(6));

        assertThat(sessions.expireSessions()).isEqualTo(1);
        assertThat(sessions.closeInactiveConnections()).isEqualTo(1);
        assertThat(channel.getCloseReason()).isEqualTo("Connection inactive");
        assertThat(sessions.totalSessions()).isEqualTo(1);
        assertThat(sessions.averageSessionDurationMs()).isEqualTo(Duration.ofMinutes(6).toMillis());
    }
}
