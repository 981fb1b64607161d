package com.example.collab.session.controller;

import com.example.collab.session.dto.CreateSessionRequest;
import com.example.collab.session.dto.UpdateSessionRequest;
import com.example.collab.session.model.Session;
import com.example.collab.session.service.SessionCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.util.Map;

@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionCoordinator sessionCoordinator;

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<Session>> getSession(@PathVariable String sessionId,
                                                    @RequestParam(required = false) String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(sessionCoordinator.getSession(sessionId, userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{sessionId}")
    public Mono<ResponseEntity<Session>> createSession(@PathVariable String sessionId,
                                                       @RequestParam(required = false) String userId,
                                                       @Valid @RequestBody(required = false) CreateSessionRequest request,
                                                       ServerWebExchange exchange) {
        String ipAddress = clientIp(exchange);
        String userAgent = exchange.getRequest().getHeaders().getFirst(HttpHeaders.USER_AGENT);
        log.info("Creating session {} for user {} from {}", sessionId, userId, ipAddress);
        return Mono.fromCallable(() -> sessionCoordinator.createSession(sessionId, userId, request, ipAddress, userAgent))
                .subscribeOn(Schedulers.boundedElastic())
                .map(session -> ResponseEntity.status(HttpStatus.CREATED).body(session));
    }

    @PutMapping("/{sessionId}")
    public Mono<ResponseEntity<Session>> updateSession(@PathVariable String sessionId,
                                                       @RequestParam(required = false) String userId,
                                                       @Valid @RequestBody UpdateSessionRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(sessionCoordinator.updateSession(sessionId, request, userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Map<String, Object>>> deleteSession(@PathVariable String sessionId,
                                                                   @RequestParam(required = false) String userId) {
        log.info("Delete request for session {} by user {}", sessionId, userId);
        return Mono.fromCallable(() -> {
                    sessionCoordinator.deleteSession(sessionId, userId);
                    return ResponseEntity.ok(Map.<String, Object>of("success", true));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @RequestMapping(value = {"", "/"}, method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.DELETE})
    public Mono<ResponseEntity<Session>> missingSessionId() {
        return Mono.error(new IllegalArgumentException("Session ID required"));
    }

    static String clientIp(ServerWebExchange exchange) {
        String forwarded = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
        return remote != null && remote.getAddress() != null ? remote.getAddress().getHostAddress() : "unknown";
    }
}
