package com.example.collab.session.controller;

import com.example.collab.session.service.RoomCoordinator;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.service.SessionTokenVerifier;
import com.example.collab.session.websocket.CollabWebSocketHandler;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequiredArgsConstructor
@Slf4j
public class WebSocketUpgradeController {

    private final SessionCoordinator sessionCoordinator;
    private final RoomCoordinator roomCoordinator;
    private final SessionTokenVerifier tokenVerifier;
    private final CollabWebSocketHandler webSocketHandler;
    private final WebSocketService webSocketService;

    @GetMapping("/websocket")
    @RateLimiter(name = "websocketConnectLimiter", fallbackMethod = "connectFallback")
    public Mono<Void> connect(
            @RequestParam(required = false) String sessionId,
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String roomId,
            @RequestParam(required = false) String token,
            ServerWebExchange exchange) {

        String upgrade = exchange.getRequest().getHeaders().getUpgrade();
        if (!"websocket".equalsIgnoreCase(upgrade)) {
            return Mono.error(new ResponseStatusException(HttpStatus.UPGRADE_REQUIRED, "Expected websocket"));
        }
        if (sessionId == null || sessionId.isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Session ID required"));
        }

        log.info("[CONNECT_START] WebSocket upgrade for sessionId='{}', userId='{}', roomId='{}'", sessionId, userId, roomId);
        return Mono.fromRunnable(() -> validate(sessionId, roomId, token))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.defer(() -> webSocketService.handleRequest(exchange,
                        session -> webSocketHandler.handle(session, sessionId, userId, roomId))));
    }

    public Mono<Void> connectFallback(String sessionId, String userId, String roomId, String token,
                                      ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded for session: {}. IP: {}. Details: {}",
                sessionId, exchange.getRequest().getRemoteAddress(), ex.getMessage());
        return Mono.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Connection rate limit exceeded. Please try again later."));
    }

    private void validate(String sessionId, String roomId, String token) {
        if (sessionCoordinator.findSession(sessionId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
        if (roomId != null && !roomId.isBlank() && roomCoordinator.findRoom(roomId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Room not found");
        }
        if (token != null && tokenVerifier.verify(token, sessionId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid token");
        }
    }
}
