package com.example.collab.shared.store;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.exception.StorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "collab.store", name = "type", havingValue = "redis")
public class RedisDurableStore implements DurableStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String documentPrefix;
    private final String alarmPrefix;

    public RedisDurableStore(@Qualifier("collabRedisTemplate") StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.documentPrefix = appProperties.getStore().getKeyPrefix() + "doc:";
        this.alarmPrefix = appProperties.getStore().getKeyPrefix() + "alarm:";
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            String json = redisTemplate.opsForValue().get(documentPrefix + key);
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new StorageException("Unreadable document at " + key, e);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read " + key, e);
        }
    }

    @Override
    public void put(String key, Object value) {
        put(key, value, null);
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        try {
            String json = objectMapper.writeValueAsString(value);
            if (ttl == null) {
                redisTemplate.opsForValue().set(documentPrefix + key, json);
            } else {
                redisTemplate.opsForValue().set(documentPrefix + key, json, ttl);
            }
        } catch (JsonProcessingException e) {
            throw new StorageException("Could not serialize document for " + key, e);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to write " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(documentPrefix + key));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete " + key, e);
        }
    }

    @Override
    public Set<String> keys(String prefix) {
        String fullPrefix = documentPrefix + prefix;
        ScanOptions options = ScanOptions.scanOptions().match(fullPrefix + "*").count(500).build();
        try {
            Set<String> keys = redisTemplate.execute((RedisCallback<Set<String>>) connection -> {
                Set<String> found = new HashSet<>();
                try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                    while (cursor.hasNext()) {
                        found.add(new String(cursor.next(), StandardCharsets.UTF_8).substring(documentPrefix.length()));
                    }
                }
                return found;
            });
            return keys != null ? keys : Set.of();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list keys with prefix " + prefix, e);
        }
    }

    @Override
    public Optional<Instant> getAlarm(String name) {
        try {
            String value = redisTemplate.opsForValue().get(alarmPrefix + name);
            return value == null ? Optional.empty() : Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read alarm " + name, e);
        }
    }

    @Override
    public void setAlarm(String name, Instant fireAt) {
        try {
            redisTemplate.opsForValue().set(alarmPrefix + name, String.valueOf(fireAt.toEpochMilli()));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to set alarm " + name, e);
        }
    }

    @Override
    public void deleteAlarm(String name) {
        try {
            redisTemplate.delete(alarmPrefix + name);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to clear alarm " + name, e);
        }
    }
}
