package com.example.collab.session.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionEventType {
    SESSION_CREATED,
    SESSION_UPDATED,
    SESSION_DELETED,
    USER_CONNECTED,
    USER_DISCONNECTED,
    DATA_MESSAGE,
    ROOM_CREATED,
    ROOM_JOINED,
    ROOM_LEFT,
    ROOM_UPDATED,
    ROOM_DELETED,
    SECURITY_ALERT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SessionEventType fromValue(String value) {
        return valueOf(value.toUpperCase());
    }

    public boolean isRoomLifecycle() {
        return this == ROOM_CREATED || this == ROOM_JOINED || this == ROOM_LEFT
                || this == ROOM_UPDATED || this == ROOM_DELETED;
    }
}
