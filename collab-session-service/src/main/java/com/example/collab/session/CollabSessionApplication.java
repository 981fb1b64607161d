package com.example.collab.session;

import com.example.collab.shared.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Real-time session and collaboration coordinator.
 *
 * Multiplexes WebSocket connections per session, manages collaboration rooms with
 * role based permissions, and enforces per-connection message quotas through the shared
 * quota and cache services.
 */
@SpringBootApplication(scanBasePackages = "com.example.collab")
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties({
    AppProperties.class
})
public class CollabSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollabSessionApplication.class, args);
    }
}
