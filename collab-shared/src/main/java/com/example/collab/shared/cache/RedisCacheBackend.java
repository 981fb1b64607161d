package com.example.collab.shared.cache;

import com.example.collab.shared.config.AppProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "collab.store", name = "type", havingValue = "redis")
public class RedisCacheBackend implements CacheBackend {

    private static final RedisScript<Long> UNLOCK_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String entryPrefix;
    private final String tagPrefix;
    private final String lockPrefix;

    public RedisCacheBackend(@Qualifier("collabRedisTemplate") StringRedisTemplate redisTemplate,
                             ObjectMapper objectMapper,
                             AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        String prefix = appProperties.getStore().getKeyPrefix();
        this.entryPrefix = prefix + "cache:";
        this.tagPrefix = prefix + "cachetag:";
        this.lockPrefix = prefix + "lock:";
    }

    @Override
    public Optional<CacheEntry> read(String namespace, String key) {
        String json = redisTemplate.opsForValue().get(entryKey(namespace, key));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, CacheEntry.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}:{}", namespace, key);
            redisTemplate.delete(entryKey(namespace, key));
            return Optional.empty();
        }
    }

    @Override
    public void write(CacheEntry entry, Duration retention) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for " + entry.getKey() + " is not serializable", e);
        }
        String redisKey = entryKey(entry.getNamespace(), entry.getKey());
        if (retention == null) {
            redisTemplate.opsForValue().set(redisKey, json);
        } else {
            redisTemplate.opsForValue().set(redisKey, json, retention);
        }
    }

    @Override
    public boolean remove(String namespace, String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(entryKey(namespace, key)));
    }

    @Override
    public Set<String> keys(String namespace) {
        String prefix = entryPrefix + namespace + ":";
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(500).build();
        Set<String> keys = redisTemplate.execute((RedisCallback<Set<String>>) connection -> {
            Set<String> found = new HashSet<>();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    found.add(new String(cursor.next(), StandardCharsets.UTF_8).substring(prefix.length()));
                }
            }
            return found;
        });
        return keys != null ? keys : Set.of();
    }

    @Override
    public void tag(String namespace, String tag, String key, Duration retention) {
        String redisKey = tagKey(namespace, tag);
        redisTemplate.opsForSet().add(redisKey, key);
        if (retention == null) {
            redisTemplate.persist(redisKey);
            return;
        }
        // a fresh set reports -1 (no expiry), so anything shorter than the new member's retention is raised
        Long remainingSeconds = redisTemplate.getExpire(redisKey);
        if (remainingSeconds == null || remainingSeconds < retention.getSeconds()) {
            redisTemplate.expire(redisKey, retention);
        }
    }

    @Override
    public void untag(String namespace, String tag, String key) {
        redisTemplate.opsForSet().remove(tagKey(namespace, tag), key);
    }

    @Override
    public Set<String> taggedKeys(String namespace, String tag) {
        String redisKey = tagKey(namespace, tag);
        Set<String> members = redisTemplate.opsForSet().members(redisKey);
        if (members == null || members.isEmpty()) {
            return Set.of();
        }
        Set<String> live = new HashSet<>();
        for (String member : members) {
            if (Boolean.TRUE.equals(redisTemplate.hasKey(entryKey(namespace, member)))) {
                live.add(member);
            } else {
                redisTemplate.opsForSet().remove(redisKey, member);
            }
        }
        return live;
    }

    @Override
    public void dropTag(String namespace, String tag) {
        redisTemplate.delete(tagKey(namespace, tag));
    }

    @Override
    public boolean tryLock(String lockKey, String owner, Duration lease) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(lockPrefix + lockKey, owner, lease));
    }

    @Override
    public void unlock(String lockKey, String owner) {
        redisTemplate.execute(UNLOCK_SCRIPT, List.of(lockPrefix + lockKey), owner);
    }

    private String entryKey(String namespace, String key) {
        return entryPrefix + namespace + ":" + key;
    }

    private String tagKey(String namespace, String tag) {
        return tagPrefix + namespace + ":" + tag;
    }
}
