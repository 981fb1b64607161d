package com.example.collab.shared.quota;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base limits per quota type and period, scaled by subscription tier.
 */
@Component
public class QuotaLimits {

    public static final String API_REQUESTS = "api_requests";
    public static final String FILE_UPLOADS = "file_uploads";
    public static final String EXECUTION_TIME = "execution_time";
    public static final String BANDWIDTH = "bandwidth";
    public static final String STORAGE = "storage";
    public static final String JOBS_PER_HOUR = "jobs_per_hour";
    public static final String FILE_SIZE = "file_size";
    public static final String WEBSOCKET_MESSAGES = "websocket_messages";

    private static final long MEGABYTE = 1024L * 1024L;

    private final List<QuotaLimit> limits = new ArrayList<>();

    public QuotaLimits() {
        limits.add(new QuotaLimit(API_REQUESTS, QuotaPeriod.HOUR, 100, 5, 20));
        limits.add(new QuotaLimit(API_REQUESTS, QuotaPeriod.DAY, 1000, 10, 50));
        limits.add(new QuotaLimit(FILE_UPLOADS, QuotaPeriod.HOUR, 10, 5, 20));
        limits.add(new QuotaLimit(FILE_UPLOADS, QuotaPeriod.DAY, 50, 10, 100));
        limits.add(new QuotaLimit(EXECUTION_TIME, QuotaPeriod.HOUR, 30_000, 10, 100));
        limits.add(new QuotaLimit(EXECUTION_TIME, QuotaPeriod.DAY, 300_000, 20, 200));
        limits.add(new QuotaLimit(BANDWIDTH, QuotaPeriod.DAY, 100 * MEGABYTE, 10, 100));
        limits.add(new QuotaLimit(STORAGE, QuotaPeriod.DAY, 50 * MEGABYTE, 10, 100));
        limits.add(new QuotaLimit(JOBS_PER_HOUR, QuotaPeriod.HOUR, 20, 5, 20));
        limits.add(new QuotaLimit(FILE_SIZE, QuotaPeriod.MINUTE, 10 * MEGABYTE, 10, 100));
        limits.add(new QuotaLimit(WEBSOCKET_MESSAGES, QuotaPeriod.MINUTE, 60, 10, 100));
    }

    /**
     * Looks up the limit for a quota type. Without an explicit period, the hourly limit is preferred,
     * then whichever period the type is configured for.
     */
    public Optional<QuotaLimit> find(String quotaType, QuotaPeriod period) {
        if (period != null) {
            return limits.stream()
                    .filter(l -> l.getQuotaType().equals(quotaType) && l.getPeriod() == period)
                    .findFirst();
        }
        Optional<QuotaLimit> hourly = find(quotaType, QuotaPeriod.HOUR);
        if (hourly.isPresent()) {
            return hourly;
        }
        return limits.stream().filter(l -> l.getQuotaType().equals(quotaType)).findFirst();
    }

    public List<QuotaLimit> all() {
        return List.copyOf(limits);
    }
}
