package com.example.collab.shared.store;

import com.example.collab.shared.exception.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(prefix = "collab.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDurableStore implements DurableStore {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final Map<String, Instant> alarms = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryDurableStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Document document = documents.get(key);
        if (document == null) {
            return Optional.empty();
        }
        if (document.expiresAtMs != null && document.expiresAtMs <= clock.millis()) {
            documents.remove(key, document);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(document.json, type));
        } catch (JsonProcessingException e) {
            throw new StorageException("Unreadable document at " + key, e);
        }
    }

    @Override
    public void put(String key, Object value) {
        put(key, value, null);
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        try {
            Long expiresAt = ttl == null ? null : clock.millis() + ttl.toMillis();
            documents.put(key, new Document(objectMapper.writeValueAsString(value), expiresAt));
        } catch (JsonProcessingException e) {
            throw new StorageException("Could not serialize document for " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        return documents.remove(key) != null;
    }

    @Override
    public Set<String> keys(String prefix) {
        long now = clock.millis();
        return documents.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .filter(e -> e.getValue().expiresAtMs == null || e.getValue().expiresAtMs > now)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    @Override
    public Optional<Instant> getAlarm(String name) {
        return Optional.ofNullable(alarms.get(name));
    }

    @Override
    public void setAlarm(String name, Instant fireAt) {
        alarms.put(name, fireAt);
    }

    @Override
    public void deleteAlarm(String name) {
        alarms.remove(name);
    }

    @AllArgsConstructor
    private static class Document {
        private final String json;
        private final Long expiresAtMs;
    }
}
