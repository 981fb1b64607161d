package com.example.collab.session.model;

import com.example.collab.session.websocket.FrameChannel;
import com.example.collab.shared.user.SubscriptionTier;
import lombok.Getter;
import lombok.Setter;
import reactor.core.Disposable;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A live WebSocket connection owned by this instance. Never persisted; sessions keep a
 * {@link ConnectionRef} and room participants reference it by id.
 */
@Getter
public class Connection {

    private final String id;
    private final String sessionId;
    private final String ownerUserId;
    private final long connectedAt;
    private final Map<String, String> metadata;
    private final SubscriptionTier subscriptionTier;
    private final String rateLimitKey;
    private final FrameChannel channel;
    private final Set<String> roomIds = ConcurrentHashMap.newKeySet();

    @Setter
    private volatile long lastActivityAt;
    @Setter
    private volatile long lastPingAt;
    @Setter
    private volatile long lastPongAt;
    @Setter
    private volatile ConnectionState state = ConnectionState.CONNECTING;
    @Setter
    private volatile Disposable heartbeat;

    public Connection(String id, String sessionId, String ownerUserId, long connectedAt,
                      Map<String, String> metadata, SubscriptionTier subscriptionTier, FrameChannel channel) {
        this.id = id;
        this.sessionId = sessionId;
        this.ownerUserId = ownerUserId;
        this.connectedAt = connectedAt;
        this.metadata = metadata;
        this.subscriptionTier = subscriptionTier == null ? SubscriptionTier.FREE : subscriptionTier;
        this.rateLimitKey = ownerUserId != null ? "session:" + ownerUserId : "session:anonymous:" + sessionId;
        this.channel = channel;
        this.lastActivityAt = connectedAt;
        this.lastPingAt = connectedAt;
        this.lastPongAt = connectedAt;
    }

    public boolean isActive() {
        return state == ConnectionState.ACTIVE || state == ConnectionState.IDLE;
    }

    public ConnectionRef toRef() {
        return ConnectionRef.builder()
                .connectionId(id)
                .connectedAt(connectedAt)
                .lastActivityAt(lastActivityAt)
                .metadata(metadata)
                .build();
    }
}
