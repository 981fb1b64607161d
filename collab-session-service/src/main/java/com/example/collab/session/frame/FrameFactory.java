package com.example.collab.session.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class FrameFactory {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Serializes a frame, stamping it with the current time when it carries none.
     * @return the JSON text, or null if serialization fails
     */
    public String toJson(OutboundFrame frame) {
        if (frame.getTimestamp() == 0) {
            frame.setTimestamp(clock.millis());
        }
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} frame: {}", frame.getType(), e.getMessage());
            return null;
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON frame
     */
    public InboundFrame parse(String text) {
        try {
            InboundFrame frame = objectMapper.readValue(text, InboundFrame.class);
            if (frame == null || frame.getType() == null) {
                throw new IllegalArgumentException("Frame type required");
            }
            return frame;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed frame", e);
        }
    }

    public <T> T payload(InboundFrame frame, Class<T> type) {
        if (frame.getData() == null || frame.getData().isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(frame.getData(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + frame.getType().value() + " payload", e);
        }
    }

    public Object toPlain(Object value) {
        return value == null ? null : objectMapper.convertValue(value, Object.class);
    }

    public OutboundFrame connected(String connectionId, String sessionId, boolean authenticated) {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("collaboration", true);
        features.put("rateLimiting", true);
        features.put("authentication", authenticated);
        return OutboundFrame.builder()
                .type(OutboundType.CONNECTED)
                .connectionId(connectionId)
                .sessionId(sessionId)
                .features(features)
                .build();
    }

    public OutboundFrame ping() {
        return OutboundFrame.builder().type(OutboundType.PING).build();
    }

    public OutboundFrame pong() {
        return OutboundFrame.builder().type(OutboundType.PONG).build();
    }

    public OutboundFrame error(String message) {
        return OutboundFrame.builder().type(OutboundType.ERROR).error(message).build();
    }

    public OutboundFrame rateLimited(Long retryAfterMs) {
        return OutboundFrame.builder().type(OutboundType.RATE_LIMITED).retryAfter(retryAfterMs).build();
    }

    public OutboundFrame roomJoined(String roomId) {
        return OutboundFrame.builder().type(OutboundType.ROOM_JOINED).roomId(roomId).build();
    }

    public OutboundFrame roomLeft(String roomId) {
        return OutboundFrame.builder().type(OutboundType.ROOM_LEFT).roomId(roomId).build();
    }

    public OutboundFrame roomDeleted(String roomId) {
        return OutboundFrame.builder().type(OutboundType.ROOM_DELETED).roomId(roomId).build();
    }

    public OutboundFrame userJoinedRoom(String roomId, String userId, String connectionId) {
        return OutboundFrame.builder().type(OutboundType.USER_JOINED).roomId(roomId).userId(userId).connectionId(connectionId).build();
    }

    public OutboundFrame userLeftRoom(String roomId, String connectionId) {
        return OutboundFrame.builder().type(OutboundType.USER_LEFT).roomId(roomId).connectionId(connectionId).build();
    }

    /**
     * Session-level presence notice, sent as a {@code data} frame.
     */
    public OutboundFrame sessionPresence(OutboundType presence, String connectionId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", presence.value());
        data.put("connectionId", connectionId);
        return OutboundFrame.builder().type(OutboundType.DATA).connectionId(connectionId).data(data).build();
    }
}
