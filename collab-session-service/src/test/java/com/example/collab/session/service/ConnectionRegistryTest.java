package com.example.collab.session.service;

import com.example.collab.session.model.Connection;
import com.example.collab.session.model.ConnectionState;
import com.example.collab.session.support.CoordinatorHarness;
import com.example.collab.session.support.RecordingFrameChannel;
import com.example.collab.session.websocket.FrameChannel;
import com.example.collab.shared.user.SubscriptionTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private CoordinatorHarness harness;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        harness = new CoordinatorHarness();
        registry = harness.registry;
    }

    @Test
    void broadcastSkipsFailingChannelAndReachesTheRest() {
        RecordingFrameChannel first = new RecordingFrameChannel();
        RecordingFrameChannel last = new RecordingFrameChannel();
        Connection a = harness.registeredConnection("s1", "alice", first);
        Connection broken = registered("s1", new RejectingFrameChannel());
        Connection c = harness.registeredConnection("s1", "carol", last);

        int delivered = registry.sendAll(List.of(a.getId(), broken.getId(), c.getId()), harness.frameFactory.ping(), null);

        assertThat(delivered).isEqualTo(2);
        assertThat(first.framesOfType("ping")).hasSize(1);
        assertThat(last.framesOfType("ping")).hasSize(1);
        assertThat(broken.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(harness.metrics.snapshot()).containsEntry("totalErrors", 1L);
    }

    @Test
    void throwingChannelIsMarkedClosedAndNotRetried() {
        ThrowingFrameChannel channel = new ThrowingFrameChannel();
        Connection connection = registered("s1", channel);

        assertThat(registry.send(connection, harness.frameFactory.ping())).isFalse();
        assertThat(registry.send(connection, harness.frameFactory.ping())).isFalse();

        assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(channel.attempts).isEqualTo(1);
    }

    @Test
    void excludedAndUnknownConnectionsAreSkipped() {
        RecordingFrameChannel channel = new RecordingFrameChannel();
        Connection sender = harness.registeredConnection("s1", "alice", new RecordingFrameChannel());
        Connection receiver = harness.registeredConnection("s1", "bob", channel);

        int delivered = registry.sendAll(List.of(sender.getId(), receiver.getId(), "gone"),
                harness.frameFactory.ping(), sender.getId());

        assertThat(delivered).isEqualTo(1);
        assertThat(channel.framesOfType("ping")).hasSize(1);
    }

    private Connection registered(String sessionId, FrameChannel channel) {
        Connection connection = new Connection(UUID.randomUUID().toString(), sessionId, "bob", harness.clock.millis(),
                Map.of(), SubscriptionTier.FREE, channel);
        connection.setState(ConnectionState.ACTIVE);
        registry.register(connection);
        return connection;
    }

    private static class RejectingFrameChannel implements FrameChannel {

        @Override
        public boolean send(String frame) {
            return false;
        }

        @Override
        public void close(int code, String reason) {
        }

        @Override
        public boolean isOpen() {
            return true;
        }
    }

    private static class ThrowingFrameChannel implements FrameChannel {

        private int attempts;

        @Override
        public boolean send(String frame) {
            attempts++;
            throw new IllegalStateException("send buffer overflow");
        }

        @Override
        public void close(int code, String reason) {
        }

        @Override
        public boolean isOpen() {
            return true;
        }
    }
}
