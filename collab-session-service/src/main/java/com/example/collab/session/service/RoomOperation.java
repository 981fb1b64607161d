package com.example.collab.session.service;

import java.util.Optional;

/**
 * Collaboration operations that mutate room data. Any other authorised operation name is relayed
 * to the room unchanged.
 */
public enum RoomOperation {
    UPDATE_DATA("update_data"),
    APPEND_DATA("append_data"),
    CLEAR_DATA("clear_data");

    private final String value;

    RoomOperation(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<RoomOperation> of(String operation) {
        for (RoomOperation op : values()) {
            if (op.value.equals(operation)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
