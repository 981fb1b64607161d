package com.example.collab.session.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class WebSocketFrameChannel implements FrameChannel {

    private final WebSocketSession session;
    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebSocketFrameChannel(WebSocketSession session) {
        this.session = session;
    }

    public Flux<WebSocketMessage> outbound() {
        return sink.asFlux().map(session::textMessage);
    }

    @Override
    public boolean send(String frame) {
        if (frame == null || !isOpen()) {
            return false;
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            log.warn("Failed to emit frame on WebSocket session {}. Result: {}", session.getId(), result);
            return false;
        }
        return true;
    }

    @Override
    public void close(int code, String reason) {
        if (closed.compareAndSet(false, true)) {
            sink.tryEmitComplete();
            session.close(new CloseStatus(code, reason))
                    .subscribe(null, e -> log.debug("Close of WebSocket session {} failed: {}", session.getId(), e.getMessage()));
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }

    /**
     * Marks the channel closed after the peer went away.
     */
    void markClosed() {
        if (closed.compareAndSet(false, true)) {
            sink.tryEmitComplete();
        }
    }
}
