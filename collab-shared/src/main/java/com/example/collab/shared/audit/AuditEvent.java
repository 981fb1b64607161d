package com.example.collab.shared.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {
    private String action;
    private String userId;
    private String resourceType;
    private String resourceId;
    private String severity;
    private Map<String, Object> details;
    private Instant timestamp;
}
