package com.example.collab.shared.quota;

import com.example.collab.shared.aspect.Monitored;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Repository
@Monitored("repository")
@Slf4j
@ConditionalOnProperty(prefix = "collab.quota", name = "store-type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcQuotaCounterStore implements QuotaCounterStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcQuotaCounterStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    private final RowMapper<QuotaCounter> counterRowMapper = (rs, rowNum) -> QuotaCounter.builder()
            .id(rs.getLong("id"))
            .identifier(rs.getString("identifier"))
            .quotaType(rs.getString("quota_type"))
            .period(QuotaPeriod.fromValue(rs.getString("period")))
            .periodStart(Instant.ofEpochMilli(rs.getLong("period_start")))
            .periodEnd(Instant.ofEpochMilli(rs.getLong("period_end")))
            .usedCount(rs.getLong("used_count"))
            .limitCount(rs.getLong("limit_count"))
            .overridden(rs.getBoolean("overridden"))
            .anonymous(rs.getBoolean("anonymous"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();

    @Override
    public QuotaCounter getOrCreate(QuotaWindow window, long limit, boolean anonymous) {
        Optional<QuotaCounter> existing = find(window);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return insert(window, limit, false, anonymous);
        } catch (DuplicateKeyException e) {
            // Lost the race to create this window's row; use the winner's.
            return find(window).orElseThrow(() -> e);
        }
    }

    @Override
    public Optional<QuotaCounter> find(QuotaWindow window) {
        String sql = """
            SELECT * FROM quota_counters
            WHERE identifier = ? AND quota_type = ? AND period = ? AND period_start = ?
            """;
        return jdbcTemplate.query(sql, counterRowMapper,
                window.getIdentifier(), window.getQuotaType(), window.getPeriod().value(), window.getStart().toEpochMilli())
                .stream().findFirst();
    }

    @Override
    public Optional<QuotaCounter> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM quota_counters WHERE id = ?", counterRowMapper, id)
                .stream().findFirst();
    }

    @Override
    public Optional<QuotaCounter> tryConsume(long counterId, long amount, long limit) {
        String sql = """
            UPDATE quota_counters
            SET used_count = used_count + ?, limit_count = ?, updated_at = ?
            WHERE id = ? AND used_count + ? <= ?
            """;
        int updated = jdbcTemplate.update(sql, amount, limit, now(), counterId, amount, limit);
        return updated == 1 ? findById(counterId) : Optional.empty();
    }

    @Override
    public boolean reset(QuotaWindow window) {
        String sql = """
            UPDATE quota_counters SET used_count = 0, updated_at = ?
            WHERE identifier = ? AND quota_type = ? AND period = ? AND period_start = ?
            """;
        return jdbcTemplate.update(sql, now(), window.getIdentifier(), window.getQuotaType(),
                window.getPeriod().value(), window.getStart().toEpochMilli()) > 0;
    }

    @Override
    public QuotaCounter overrideLimit(QuotaWindow window, long newLimit, boolean anonymous) {
        String sql = """
            UPDATE quota_counters SET limit_count = ?, overridden = TRUE, updated_at = ?
            WHERE identifier = ? AND quota_type = ? AND period = ? AND period_start = ?
            """;
        int updated = jdbcTemplate.update(sql, newLimit, now(), window.getIdentifier(), window.getQuotaType(),
                window.getPeriod().value(), window.getStart().toEpochMilli());
        if (updated == 0) {
            try {
                return insert(window, newLimit, true, anonymous);
            } catch (DuplicateKeyException e) {
                return overrideLimit(window, newLimit, anonymous);
            }
        }
        return find(window).orElseThrow();
    }

    @Override
    public QuotaTypeStats summarize(String quotaType, QuotaPeriod period, Instant periodStart) {
        String sql = """
            SELECT COUNT(*) AS counters,
                   COALESCE(SUM(CASE WHEN used_count >= limit_count THEN 1 ELSE 0 END), 0) AS exhausted,
                   COALESCE(SUM(used_count), 0) AS total_used,
                   COALESCE(AVG(CASE WHEN limit_count > 0 THEN used_count * 100.0 / limit_count ELSE 0 END), 0) AS utilization
            FROM quota_counters
            WHERE quota_type = ? AND period = ? AND period_start = ?
            """;
        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> QuotaTypeStats.builder()
                .quotaType(quotaType)
                .period(period)
                .counters(rs.getLong("counters"))
                .exhausted(rs.getLong("exhausted"))
                .totalUsed(rs.getLong("total_used"))
                .averageUtilization(rs.getDouble("utilization"))
                .build(), quotaType, period.value(), periodStart.toEpochMilli());
    }

    @Override
    public int deleteEndedBefore(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM quota_counters WHERE period_end < ?", cutoff.toEpochMilli());
    }

    private QuotaCounter insert(QuotaWindow window, long limit, boolean overridden, boolean anonymous) {
        String sql = """
            INSERT INTO quota_counters
                (identifier, quota_type, period, period_start, period_end, used_count, limit_count, overridden, anonymous, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, 0, ?, ?, ?, ?, ?)
            """;
        Timestamp now = now();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, window.getIdentifier());
            ps.setString(2, window.getQuotaType());
            ps.setString(3, window.getPeriod().value());
            ps.setLong(4, window.getStart().toEpochMilli());
            ps.setLong(5, window.getEnd().toEpochMilli());
            ps.setLong(6, limit);
            ps.setBoolean(7, overridden);
            ps.setBoolean(8, anonymous);
            ps.setTimestamp(9, now);
            ps.setTimestamp(10, now);
            return ps;
        }, keyHolder);
        log.debug("Created quota counter for {}:{} window starting {}", window.getIdentifier(), window.getQuotaType(), window.getStart());

        Number id = keyHolder.getKey();
        return QuotaCounter.builder()
                .id(id != null ? id.longValue() : null)
                .identifier(window.getIdentifier())
                .quotaType(window.getQuotaType())
                .period(window.getPeriod())
                .periodStart(window.getStart())
                .periodEnd(window.getEnd())
                .limitCount(limit)
                .overridden(overridden)
                .anonymous(anonymous)
                .createdAt(now.toInstant())
                .updatedAt(now.toInstant())
                .build();
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }
}
