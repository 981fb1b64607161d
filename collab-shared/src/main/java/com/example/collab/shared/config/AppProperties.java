package com.example.collab.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "collab")
public class AppProperties {

    private final Service service = new Service();
    private final Cache cache = new Cache();
    private final Quota quota = new Quota();
    private final Session session = new Session();
    private final Heartbeat heartbeat = new Heartbeat();
    private final Admin admin = new Admin();
    private final Store store = new Store();

    @Data
    public static class Service {
        private String name = "collab-session-service";
    }

    @Data
    public static class Store {
        /**
         * Backing store for the durable key-value store and the remote cache tier: {@code redis} or {@code memory}.
         */
        @NotBlank
        private String type = "memory";
        private String keyPrefix = "collab:";
    }

    @Data
    public static class Cache {
        private boolean localTierEnabled = true;
        @Positive
        private long localMaximumSize = 10_000;
        private Duration staleGrace = Duration.ofMinutes(10);
        private Duration lockTimeout = Duration.ofSeconds(30);
        private Duration lockBackoff = Duration.ofMillis(100);
        private Duration degradedThreshold = Duration.ofMillis(1000);
        private Map<String, Namespace> namespaces = defaultNamespaces();

        @Data
        public static class Namespace {
            private Duration defaultTtl = Duration.ofHours(1);
            private Duration maxTtl = Duration.ofHours(24);

            public Namespace() {
            }

            public Namespace(Duration defaultTtl, Duration maxTtl) {
                this.defaultTtl = defaultTtl;
                this.maxTtl = maxTtl;
            }
        }

        private static Map<String, Namespace> defaultNamespaces() {
            Map<String, Namespace> namespaces = new LinkedHashMap<>();
            namespaces.put("cache", new Namespace(Duration.ofHours(1), Duration.ofHours(24)));
            namespaces.put("rate_limit", new Namespace(Duration.ofMinutes(5), Duration.ofHours(1)));
            namespaces.put("users", new Namespace(Duration.ofMinutes(30), Duration.ofHours(24)));
            namespaces.put("analytics", new Namespace(Duration.ofMinutes(15), Duration.ofDays(7)));
            return namespaces;
        }
    }

    @Data
    public static class Quota {
        /**
         * Authoritative counter store: {@code jdbc} or {@code memory}.
         */
        private String storeType = "jdbc";
        private Duration counterCacheTtl = Duration.ofMinutes(5);
        @Positive
        private long failOpenLimit = 100;
        private Duration counterRetention = Duration.ofDays(2);
        private boolean auditEnabled = true;
        private String bypassIdentifier;
    }

    @Data
    public static class Session {
        private Duration defaultTtl = Duration.ofHours(24);
        private Duration alarmInterval = Duration.ofMinutes(5);
        private Duration inactivityTimeout = Duration.ofMinutes(5);
        @Positive
        private int workerThreads = 8;
        @Positive
        private int defaultMaxParticipants = 10;
    }

    @Data
    public static class Heartbeat {
        private Duration interval = Duration.ofSeconds(30);
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Admin {
        /**
         * Shared secret expected in the {@code X-Admin-Token} header. Admin endpoints are disabled when unset.
         */
        private String token;
    }
}
