package com.example.collab.session.service;

import com.example.collab.session.frame.FrameFactory;
import com.example.collab.session.frame.OutboundFrame;
import com.example.collab.session.model.Connection;
import com.example.collab.session.model.ConnectionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Live connections accepted by this instance, and frame delivery to them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionRegistry {

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    private final FrameFactory frameFactory;
    private final CoordinatorMetrics coordinatorMetrics;

    public void register(Connection connection) {
        connections.put(connection.getId(), connection);
        coordinatorMetrics.connectionOpened(activeCount());
    }

    public Optional<Connection> remove(String connectionId) {
        Connection removed = connections.remove(connectionId);
        if (removed != null) {
            coordinatorMetrics.connectionClosed(activeCount());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Collection<Connection> all() {
        return new ArrayList<>(connections.values());
    }

    public List<Connection> forSession(String sessionId) {
        return connections.values().stream()
                .filter(c -> c.getSessionId().equals(sessionId))
                .collect(Collectors.toList());
    }

    public int activeCount() {
        return (int) connections.values().stream().filter(Connection::isActive).count();
    }

    /**
     * Best-effort delivery. A failed send marks the connection inactive; it is removed on close
     * or by the next maintenance pass.
     */
    public boolean send(Connection connection, OutboundFrame frame) {
        if (!connection.isActive()) {
            return false;
        }
        if (!connection.getChannel().isOpen()) {
            connection.setState(ConnectionState.CLOSED);
            return false;
        }
        String json = frameFactory.toJson(frame);
        if (json == null) {
            return false;
        }
        try {
            if (connection.getChannel().send(json)) {
                return true;
            }
        } catch (RuntimeException e) {
            log.warn("Failed to send {} frame to connection {}: {}", frame.getType(), connection.getId(), e.getMessage());
        }
        connection.setState(ConnectionState.CLOSED);
        coordinatorMetrics.error("websocket");
        return false;
    }

    public boolean send(String connectionId, OutboundFrame frame) {
        Connection connection = connections.get(connectionId);
        return connection != null && send(connection, frame);
    }

    /**
     * Sends to each listed connection except {@code excludeConnectionId}.
     *
     * @return number of connections the frame was queued for
     */
    public int sendAll(Collection<String> connectionIds, OutboundFrame frame, String excludeConnectionId) {
        int delivered = 0;
        for (String connectionId : connectionIds) {
            if (connectionId.equals(excludeConnectionId)) {
                continue;
            }
            if (send(connectionId, frame)) {
                delivered++;
            }
        }
        return delivered;
    }
}
