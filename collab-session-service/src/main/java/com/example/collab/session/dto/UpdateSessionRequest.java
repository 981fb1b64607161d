package com.example.collab.session.dto;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial update. Null fields are left unchanged; {@code data} and {@code metadata} are merged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSessionRequest {
    private Map<String, Object> data;
    private Map<String, Object> metadata;
    private Boolean persistent;
    /** Extends the session by this many milliseconds from now. */
    @Positive(message = "ttl must be positive")
    private Long ttl;
}
