package com.example.collab.session.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionEvent {
    private SessionEventType type;
    private String sessionId;
    private String userId;
    private String connectionId;
    private String roomId;
    private long timestamp;
    private Map<String, Object> data;
}
