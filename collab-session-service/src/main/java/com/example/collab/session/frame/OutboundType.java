package com.example.collab.session.frame;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutboundType {
    CONNECTED,
    PONG,
    PING,
    DATA,
    ROOM_JOINED,
    ROOM_LEFT,
    USER_JOINED,
    USER_LEFT,
    ROOM_DELETED,
    COLLABORATION_UPDATE,
    RATE_LIMITED,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
