package com.example.collab.shared.user;

import com.example.collab.shared.aspect.Monitored;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
@Monitored("repository")
@RequiredArgsConstructor
@Slf4j
public class JdbcUserDirectory implements UserDirectory {

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<UserRecord> userRowMapper = (rs, rowNum) -> UserRecord.builder()
            .id(rs.getString("id"))
            .email(rs.getString("email"))
            .displayName(rs.getString("display_name"))
            .subscriptionTier(SubscriptionTier.fromValue(rs.getString("subscription_tier")))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    @Override
    @CircuitBreaker(name = "userDirectory", fallbackMethod = "findByIdFallback")
    public Optional<UserRecord> findById(String userId) {
        String sql = "SELECT id, email, display_name, subscription_tier, created_at FROM users WHERE id = ?";
        return jdbcTemplate.query(sql, userRowMapper, userId).stream().findFirst();
    }

    public Optional<UserRecord> findByIdFallback(String userId, Throwable t) {
        log.warn("User directory unavailable for user {}: {}", userId, t.getMessage());
        return Optional.empty();
    }
}
