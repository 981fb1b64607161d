package com.example.collab.session.websocket;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketFrameChannelTest {

    private WebSocketSession session;
    private WebSocketFrameChannel channel;

    @BeforeEach
    void setUp() {
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        when(session.textMessage(anyString())).thenAnswer(inv -> mock(WebSocketMessage.class));
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());
        channel = new WebSocketFrameChannel(session);
    }

    @Test
    void queuedFramesFlowUntilClose() {
        assertThat(channel.send("{\"type\":\"ping\"}")).isTrue();
        assertThat(channel.send("{\"type\":\"pong\"}")).isTrue();
        channel.close(1000, "Session deleted");

        StepVerifier.create(channel.outbound())
                .expectNextCount(2)
                .verifyComplete();

        verify(session).close(new CloseStatus(1000, "Session deleted"));
    }

    @Test
    void closedChannelRejectsFramesAndClosesOnce() {
        channel.close(1000, "bye");
        channel.close(1000, "bye");

        assertThat(channel.isOpen()).isFalse();
        assertThat(channel.send("{\"type\":\"ping\"}")).isFalse();
        verify(session, times(1)).close(any(CloseStatus.class));
    }

    @Test
    void peerDisconnectCompletesOutbound() {
        channel.markClosed();

        StepVerifier.create(channel.outbound()).verifyComplete();
        assertThat(channel.send(null)).isFalse();
    }
}
