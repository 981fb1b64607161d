package com.example.collab.session.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {
    /** Time to live in milliseconds. */
    @Positive(message = "ttl must be positive")
    private Long ttl;
    private Map<String, Object> sessionData;
    private Map<String, Object> metadata;
    private Map<String, Long> customLimits;
    private boolean persistent;
}
