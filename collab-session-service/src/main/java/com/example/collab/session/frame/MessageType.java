package com.example.collab.session.frame;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inbound frame types accepted on a connection.
 */
public enum MessageType {
    DATA,
    PING,
    HEARTBEAT,
    PONG,
    JOIN_ROOM,
    LEAVE_ROOM,
    COLLABORATION,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageType fromValue(String value) {
        if (value != null) {
            for (MessageType type : values()) {
                if (type.value().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
