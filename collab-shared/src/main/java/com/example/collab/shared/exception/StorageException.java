package com.example.collab.shared.exception;

/**
 * The durable store or a relational backing store failed an I/O operation.
 */
public class StorageException extends CollabException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
