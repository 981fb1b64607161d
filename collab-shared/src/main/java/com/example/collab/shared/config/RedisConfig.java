package com.example.collab.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis wiring for the remote cache tier and the durable store. Values are stored as JSON strings.
 */
@Configuration
@ConditionalOnProperty(prefix = "collab.store", name = "type", havingValue = "redis")
public class RedisConfig {

    @Bean("collabRedisTemplate")
    public StringRedisTemplate collabRedisTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        return template;
    }
}
