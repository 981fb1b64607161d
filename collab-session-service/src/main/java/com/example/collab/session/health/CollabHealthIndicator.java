package com.example.collab.session.health;

import com.example.collab.session.service.CoordinatorStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator view of the coordinator health document.
 */
@Component
public class CollabHealthIndicator implements HealthIndicator {

    private final CoordinatorStatus coordinatorStatus;

    public CollabHealthIndicator(CoordinatorStatus coordinatorStatus) {
        this.coordinatorStatus = coordinatorStatus;
    }

    @Override
    public Health health() {
        try {
            Map<String, Object> status = coordinatorStatus.health();
            Health.Builder builder = coordinatorStatus.isHealthy(status) ? Health.up() : Health.down();
            Object details = status.get("details");
            if (details instanceof Map) {
                ((Map<?, ?>) details).forEach((key, value) -> builder.withDetail(String.valueOf(key), value));
            }
            if (status.containsKey("error")) {
                builder.withDetail("error", status.get("error"));
            }
            return builder.build();
        } catch (Exception e) {
            return Health.down().withDetail("error", e.getMessage()).build();
        }
    }
}
