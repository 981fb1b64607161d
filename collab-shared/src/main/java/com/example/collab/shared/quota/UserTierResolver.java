package com.example.collab.shared.quota;

import com.example.collab.shared.cache.CacheOptions;
import com.example.collab.shared.cache.CacheService;
import com.example.collab.shared.user.SubscriptionTier;
import com.example.collab.shared.user.UserDirectory;
import com.example.collab.shared.user.UserRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Resolves the subscription tier used to scale quota limits. IP identifiers are always {@code free}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserTierResolver {

    static final String USERS_NAMESPACE = "users";

    private final CacheService cacheService;
    private final UserDirectory userDirectory;

    public SubscriptionTier resolveTier(String identifier) {
        if (identifier == null || IdentifierClassifier.isIpAddress(identifier)) {
            return SubscriptionTier.FREE;
        }
        try {
            String tier = cacheService.getOrSet(USERS_NAMESPACE, "tier:" + identifier, String.class,
                    () -> userDirectory.findById(identifier)
                            .map(UserRecord::getSubscriptionTier)
                            .orElse(SubscriptionTier.FREE)
                            .value(),
                    CacheOptions.builder().tags(Set.of("user:" + identifier)).build());
            return SubscriptionTier.fromValue(tier);
        } catch (RuntimeException e) {
            log.warn("Could not resolve tier for {}, assuming free: {}", identifier, e.getMessage());
            return SubscriptionTier.FREE;
        }
    }
}
