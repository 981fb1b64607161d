package com.example.collab.shared.cache;

@FunctionalInterface
public interface ValueLoader<T> {
    T load() throws Exception;
}
