package com.example.collab.session.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Session {
    private String id;
    private String ownerUserId;
    private String ipAddress;
    private String userAgent;
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
    @Builder.Default
    private List<ConnectionRef> connections = new ArrayList<>();
    private long createdAt;
    private long lastAccessedAt;
    private long expiresAt;
    private boolean persistent;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private RateLimitState rateLimitState;
    private CollaborationState collaborationState;
    private SecurityState securityState;

    @JsonIgnore
    public boolean isExpired(long nowMs) {
        return nowMs > expiresAt;
    }

    /**
     * Refreshes the access time, keeping {@code expiresAt} strictly after it.
     */
    public void touch(long nowMs) {
        this.lastAccessedAt = nowMs;
        if (expiresAt <= nowMs) {
            expiresAt = nowMs + 1;
        }
    }
}
