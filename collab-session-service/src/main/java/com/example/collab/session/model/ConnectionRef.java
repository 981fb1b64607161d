package com.example.collab.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Serialisable view of a live connection, stored on its session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRef {
    private String connectionId;
    private long connectedAt;
    private long lastActivityAt;
    private Map<String, String> metadata;
}
