package com.example.collab.shared.exception;

import lombok.Getter;

@Getter
public class RoomFullException extends ResourceConflictException {

    private final String roomId;

    public RoomFullException(String roomId) {
        super("Room is full");
        this.roomId = roomId;
    }
}
