package com.example.collab.shared.quota;

import com.example.collab.shared.user.SubscriptionTier;
import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;

@Getter
public class QuotaLimit {
    private final String quotaType;
    private final QuotaPeriod period;
    private final long baseLimit;
    private final Map<SubscriptionTier, Integer> multipliers;

    public QuotaLimit(String quotaType, QuotaPeriod period, long baseLimit, int pro, int enterprise) {
        this.quotaType = quotaType;
        this.period = period;
        this.baseLimit = baseLimit;
        this.multipliers = new EnumMap<>(SubscriptionTier.class);
        this.multipliers.put(SubscriptionTier.FREE, 1);
        this.multipliers.put(SubscriptionTier.PRO, pro);
        this.multipliers.put(SubscriptionTier.ENTERPRISE, enterprise);
    }

    public long limitFor(SubscriptionTier tier) {
        return baseLimit * multipliers.getOrDefault(tier, 1);
    }
}
