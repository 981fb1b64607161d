package com.example.collab.shared.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcAuditLogSink implements AuditLogSink {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Async
    @Override
    public void append(AuditEvent event) {
        String sql = """
            INSERT INTO audit_logs (action, user_id, resource_type, resource_id, severity, details, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            Instant timestamp = event.getTimestamp() != null ? event.getTimestamp() : Instant.now();
            jdbcTemplate.update(sql,
                    event.getAction(),
                    event.getUserId(),
                    event.getResourceType(),
                    event.getResourceId(),
                    event.getSeverity(),
                    event.getDetails() != null ? objectMapper.writeValueAsString(event.getDetails()) : null,
                    Timestamp.from(timestamp));
        } catch (JsonProcessingException | DataAccessException e) {
            log.error("Failed to write audit event '{}' for {}: {}", event.getAction(), event.getResourceId(), e.getMessage());
        }
    }
}
