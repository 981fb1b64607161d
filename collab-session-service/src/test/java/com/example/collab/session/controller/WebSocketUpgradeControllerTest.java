package com.example.collab.session.controller;

import com.example.collab.session.model.SessionToken;
import com.example.collab.session.service.SessionTokenVerifier;
import com.example.collab.session.support.CoordinatorHarness;
import com.example.collab.session.websocket.CollabWebSocketHandler;
import com.example.collab.shared.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.socket.server.WebSocketService;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketUpgradeControllerTest {

    private CoordinatorHarness harness;
    private WebSocketService webSocketService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        harness = new CoordinatorHarness();
        webSocketService = mock(WebSocketService.class);
        when(webSocketService.handleRequest(any(), any())).thenReturn(Mono.empty());
        WebSocketUpgradeController controller = new WebSocketUpgradeController(harness.sessions, harness.rooms,
                new SessionTokenVerifier(harness.store, harness.clock), mock(CollabWebSocketHandler.class),
                webSocketService);
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
        harness.sessions.createSession("s1", "alice", null, null, null);
    }

    @Test
    void requiresUpgradeHeader() {
        client.get().uri("/websocket?sessionId=s1")
                .exchange()
                .expectStatus().isEqualTo(426)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Expected websocket");
    }

    @Test
    void requiresSessionId() {
        client.get().uri("/websocket")
                .header("Upgrade", "websocket")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Session ID required");
    }

    @Test
    void unknownSessionOrRoomIs404() {
        client.get().uri("/websocket?sessionId=ghost")
                .header("Upgrade", "websocket")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Session not found");

        client.get().uri("/websocket?sessionId=s1&roomId=nowhere")
                .header("Upgrade", "websocket")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Room not found");

        verify(webSocketService, never()).handleRequest(any(), any());
    }

    @Test
    void rejectsTokenBoundToAnotherSession() {
        harness.store.put("token:t-1", SessionToken.builder()
                .sessionId("other")
                .userId("alice")
                .expiresAt(harness.clock.millis() + 60_000)
                .build());

        client.get().uri("/websocket?sessionId=s1&token=t-1")
                .header("Upgrade", "websocket")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Invalid token");
    }

    @Test
    void validRequestIsHandedToWebSocketService() {
        harness.store.put("token:t-2", SessionToken.builder()
                .sessionId("s1")
                .userId("alice")
                .expiresAt(harness.clock.millis() + 60_000)
                .build());

        client.get().uri("/websocket?sessionId=s1&userId=alice&token=t-2")
                .header("Upgrade", "websocket")
                .exchange()
                .expectStatus().isOk();

        verify(webSocketService).handleRequest(any(), any());
    }
}
