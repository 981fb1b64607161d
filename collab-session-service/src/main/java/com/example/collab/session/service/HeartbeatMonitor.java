package com.example.collab.session.service;

import com.example.collab.session.frame.FrameFactory;
import com.example.collab.session.model.Connection;
import com.example.collab.session.model.ConnectionState;
import com.example.collab.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Per-connection ping timer. A connection is IDLE once a heartbeat window passes without a pong
 * and is handed to the stale callback once the pong timeout is exceeded.
 */
@Component
@Slf4j
public class HeartbeatMonitor {

    private final ConnectionRegistry connectionRegistry;
    private final FrameFactory frameFactory;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Duration interval;
    private final Duration timeout;

    public HeartbeatMonitor(ConnectionRegistry connectionRegistry,
                            FrameFactory frameFactory,
                            @Qualifier("heartbeatScheduler") Scheduler scheduler,
                            Clock clock,
                            AppProperties appProperties) {
        this.connectionRegistry = connectionRegistry;
        this.frameFactory = frameFactory;
        this.scheduler = scheduler;
        this.clock = clock;
        this.interval = appProperties.getHeartbeat().getInterval();
        this.timeout = appProperties.getHeartbeat().getTimeout();
    }

    public void start(Connection connection, Consumer<Connection> onStale) {
        Disposable timer = Flux.interval(interval, interval, scheduler)
                .subscribe(
                        tick -> checkConnection(connection, onStale),
                        e -> log.error("Heartbeat timer for connection {} failed: {}", connection.getId(), e.getMessage()));
        connection.setHeartbeat(timer);
    }

    /**
     * One heartbeat tick.
     *
     * @return false once the connection is no longer monitored
     */
    public boolean checkConnection(Connection connection, Consumer<Connection> onStale) {
        try {
            if (!connection.isActive()) {
                stop(connection);
                if (connectionRegistry.find(connection.getId()).isPresent()) {
                    // marked dead by a failed send but never torn down
                    onStale.accept(connection);
                }
                return false;
            }
            long now = clock.millis();
            long sincePong = now - connection.getLastPongAt();
            if (sincePong > timeout.toMillis()) {
                log.warn("Connection {} stale, no pong for {} ms", connection.getId(), sincePong);
                stop(connection);
                onStale.accept(connection);
                return false;
            }
            if (sincePong > interval.toMillis() && connection.getState() == ConnectionState.ACTIVE) {
                connection.setState(ConnectionState.IDLE);
            }
            if (!connectionRegistry.send(connection, frameFactory.ping())) {
                log.warn("Ping to connection {} failed, tearing it down", connection.getId());
                stop(connection);
                onStale.accept(connection);
                return false;
            }
            connection.setLastPingAt(now);
            return true;
        } catch (Exception e) {
            log.error("Error in heartbeat for connection {}: {}", connection.getId(), e.getMessage());
            return true;
        }
    }

    public void pongReceived(Connection connection) {
        connection.setLastPongAt(clock.millis());
        if (connection.getState() == ConnectionState.IDLE) {
            connection.setState(ConnectionState.ACTIVE);
        }
    }

    public void stop(Connection connection) {
        Disposable timer = connection.getHeartbeat();
        if (timer != null && !timer.isDisposed()) {
            timer.dispose();
        }
    }
}
