package com.example.collab.session.frame;

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
public class OutboundFrame {
    private OutboundType type;
    private String sessionId;
    private String connectionId;
    private String roomId;
    private String userId;
    private String operation;
    private Object data;
    private String error;
    private Long retryAfter;
    private Map<String, Object> features;
    private long timestamp;
}
