package com.example.collab.session.websocket;

import com.example.collab.session.model.Connection;
import com.example.collab.session.service.MessageDispatcher;
import com.example.collab.session.service.SessionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bridges an accepted WebSocket to the coordinator. Inbound frames are dispatched one at a time
 * in receipt order; outbound frames flow through the connection's {@link WebSocketFrameChannel}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollabWebSocketHandler {

    private final SessionCoordinator sessionCoordinator;
    private final MessageDispatcher messageDispatcher;

    public Mono<Void> handle(WebSocketSession webSocketSession, String sessionId, String userId, String roomId) {
        WebSocketFrameChannel channel = new WebSocketFrameChannel(webSocketSession);
        Map<String, String> metadata = metadata(webSocketSession.getHandshakeInfo());

        return Mono.fromCallable(() -> sessionCoordinator.openConnection(sessionId, userId, roomId, metadata, channel))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(connection -> {
                    Mono<Void> input = webSocketSession.receive()
                            .map(WebSocketMessage::getPayloadAsText)
                            .concatMap(text -> Mono.fromRunnable(() -> messageDispatcher.dispatch(connection, text))
                                    .subscribeOn(Schedulers.boundedElastic())
                                    .onErrorResume(e -> {
                                        log.warn("Frame on connection {} was not handled: {}", connection.getId(), e.getMessage());
                                        return Mono.empty();
                                    }))
                            .then()
                            .doFinally(signal -> {
                                channel.markClosed();
                                cleanupAsync(connection, webSocketSession);
                            });
                    Mono<Void> output = webSocketSession.send(channel.outbound());
                    return Mono.when(input, output);
                })
                .onErrorResume(e -> {
                    log.error("WebSocket session {} for session {} failed: {}", webSocketSession.getId(), sessionId, e.getMessage());
                    return webSocketSession.close(CloseStatus.SERVER_ERROR);
                });
    }

    private void cleanupAsync(Connection connection, WebSocketSession webSocketSession) {
        Schedulers.boundedElastic().schedule(() -> {
            try {
                sessionCoordinator.closeConnection(connection, 1000, "Client closed");
            } catch (Exception e) {
                log.error("Cleanup of connection {} (socket {}) failed: {}", connection.getId(), webSocketSession.getId(), e.getMessage());
            }
        });
    }

    private static Map<String, String> metadata(HandshakeInfo info) {
        Map<String, String> metadata = new LinkedHashMap<>();
        InetSocketAddress remote = info.getRemoteAddress();
        metadata.put("ip", remote != null && remote.getAddress() != null ? remote.getAddress().getHostAddress() : "unknown");
        metadata.put("userAgent", headerOrUnknown(info, "User-Agent"));
        metadata.put("origin", headerOrUnknown(info, "Origin"));
        metadata.put("protocol", info.getSubProtocol() != null ? info.getSubProtocol() : "unknown");
        return metadata;
    }

    private static String headerOrUnknown(HandshakeInfo info, String name) {
        String value = info.getHeaders().getFirst(name);
        return value != null ? value : "unknown";
    }
}
