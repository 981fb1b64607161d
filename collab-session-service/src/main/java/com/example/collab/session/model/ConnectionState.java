package com.example.collab.session.model;

public enum ConnectionState {
    CONNECTING,
    ACTIVE,
    /** No pong within the current heartbeat window. */
    IDLE,
    CLOSED
}
