package com.example.collab.shared.quota;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Fixed, UTC-aligned counting windows.
 */
public enum QuotaPeriod {
    MINUTE(ChronoUnit.MINUTES),
    HOUR(ChronoUnit.HOURS),
    DAY(ChronoUnit.DAYS);

    private final ChronoUnit unit;

    QuotaPeriod(ChronoUnit unit) {
        this.unit = unit;
    }

    public Instant windowStart(Instant now) {
        return now.truncatedTo(unit);
    }

    public Instant windowEnd(Instant windowStart) {
        return windowStart.plus(length());
    }

    public Duration length() {
        return unit.getDuration();
    }

    public QuotaWindow windowFor(String identifier, String quotaType, Instant now) {
        Instant start = windowStart(now);
        return new QuotaWindow(identifier, quotaType, this, start, windowEnd(start));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QuotaPeriod fromValue(String value) {
        for (QuotaPeriod period : values()) {
            if (period.name().equalsIgnoreCase(value)) {
                return period;
            }
        }
        throw new IllegalArgumentException("Unknown quota period: " + value);
    }
}
