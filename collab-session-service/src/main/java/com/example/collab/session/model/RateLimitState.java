package com.example.collab.session.model;

import com.example.collab.shared.user.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitState {
    private SubscriptionTier tier;
    private long windowStart;
    private long requestCount;
    private Map<String, Long> customLimits;
}
