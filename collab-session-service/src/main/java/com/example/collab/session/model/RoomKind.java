package com.example.collab.session.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RoomKind {
    DOCUMENT,
    CHAT,
    WHITEBOARD,
    CODE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RoomKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DOCUMENT;
        }
        for (RoomKind kind : values()) {
            if (kind.value().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown room type: " + value);
    }
}
