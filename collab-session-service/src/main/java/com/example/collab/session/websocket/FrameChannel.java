package com.example.collab.session.websocket;

/**
 * Outbound side of a client connection.
 */
public interface FrameChannel {

    /**
     * @return false if the frame could not be queued for delivery
     */
    boolean send(String frame);

    void close(int code, String reason);

    boolean isOpen();
}
