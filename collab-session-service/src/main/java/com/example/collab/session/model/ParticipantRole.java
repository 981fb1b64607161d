package com.example.collab.session.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantRole {
    OWNER,
    EDITOR,
    VIEWER;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ParticipantRole fromValue(String value) {
        for (ParticipantRole role : values()) {
            if (role.value().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown participant role: " + value);
    }
}
