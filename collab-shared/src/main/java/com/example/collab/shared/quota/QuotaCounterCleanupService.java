package com.example.collab.shared.quota;

import com.example.collab.shared.aspect.Monitored;
import com.example.collab.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class QuotaCounterCleanupService {

    private final QuotaCounterStore counterStore;
    private final AppProperties appProperties;
    private final Clock clock;

    @Monitored("scheduler")
    @Scheduled(fixedRateString = "${collab.quota.cleanup-rate-ms:3600000}", initialDelayString = "${collab.quota.cleanup-initial-delay-ms:60000}")
    @SchedulerLock(name = "purgeEndedQuotaCounters", lockAtLeastFor = "PT1M", lockAtMostFor = "PT10M")
    public void purgeEndedCounters() {
        Instant cutoff = clock.instant().minus(appProperties.getQuota().getCounterRetention());
        try {
            int removed = counterStore.deleteEndedBefore(cutoff);
            if (removed > 0) {
                log.info("Purged {} quota counters whose window ended before {}", removed, cutoff);
            }
        } catch (Exception e) {
            log.error("Quota counter purge failed.", e);
        }
    }
}
