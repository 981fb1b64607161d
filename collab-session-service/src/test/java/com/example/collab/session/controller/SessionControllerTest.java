package com.example.collab.session.controller;

import com.example.collab.session.support.CoordinatorHarness;
import com.example.collab.shared.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

class SessionControllerTest {

    private CoordinatorHarness harness;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        harness = new CoordinatorHarness();
        client = WebTestClient.bindToController(new SessionController(harness.sessions))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createReturns201AndForwardedClientAddress() {
        client.post().uri("/session/s1?userId=alice")
                .header("X-Forwarded-For", "198.51.100.4, 10.0.0.1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ttl", 60_000, "sessionData", Map.of("theme", "dark")))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo("s1")
                .jsonPath("$.ownerUserId").isEqualTo("alice")
                .jsonPath("$.ipAddress").isEqualTo("198.51.100.4")
                .jsonPath("$.data.theme").isEqualTo("dark");
    }

    @Test
    void createWithoutBodyUsesDefaults() {
        client.post().uri("/session/s1")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.persistent").isEqualTo(false);
    }

    @Test
    void duplicateCreateIsConflict() {
        harness.sessions.createSession("s1", "alice", null, null, null);

        client.post().uri("/session/s1?userId=alice")
                .exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    void invalidTtlIsRejected() {
        client.post().uri("/session/s1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ttl", -5))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Validation Failed");
    }

    @Test
    void getHidesPrivateStateFromOtherUsers() {
        harness.sessions.createSession("s1", "alice", null, null, null);

        client.get().uri("/session/s1?userId=alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rateLimitState.tier").isEqualTo("free");

        client.get().uri("/session/s1?userId=mallory")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rateLimitState").doesNotExist()
                .jsonPath("$.securityState").doesNotExist();
    }

    @Test
    void missingSessionIs404() {
        client.get().uri("/session/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Session not found")
                .jsonPath("$.path").isEqualTo("/session/nope");
    }

    @Test
    void missingSessionIdIs400() {
        client.get().uri("/session/")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Session ID required");
    }

    @Test
    void unsupportedMethodIs405() {
        client.method(HttpMethod.PATCH).uri("/session/s1")
                .exchange()
                .expectStatus().isEqualTo(405);
    }

    @Test
    void updateByNonOwnerIsForbidden() {
        harness.sessions.createSession("s1", "alice", null, null, null);

        client.put().uri("/session/s1?userId=mallory")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("data", Map.of("x", 1)))
                .exchange()
                .expectStatus().isForbidden();

        client.put().uri("/session/s1?userId=alice")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("data", Map.of("x", 1)))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.x").isEqualTo(1);
    }

    @Test
    void deleteThenDeleteAgain() {
        harness.sessions.createSession("s1", "alice", null, null, null);

        client.delete().uri("/session/s1?userId=alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);

        client.delete().uri("/session/s1?userId=alice")
                .exchange()
                .expectStatus().isNotFound();
    }
}
