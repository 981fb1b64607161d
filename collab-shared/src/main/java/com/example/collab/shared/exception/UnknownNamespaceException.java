package com.example.collab.shared.exception;

public class UnknownNamespaceException extends CollabException {

    public UnknownNamespaceException(String namespace) {
        super("Unknown cache namespace: " + namespace);
    }
}
