package com.example.collab.shared.user;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubscriptionTier {
    FREE,
    PRO,
    ENTERPRISE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Unknown or missing tiers are treated as {@link #FREE}.
     */
    @JsonCreator
    public static SubscriptionTier fromValue(String value) {
        if (value == null) {
            return FREE;
        }
        for (SubscriptionTier tier : values()) {
            if (tier.name().equalsIgnoreCase(value.trim())) {
                return tier;
            }
        }
        return FREE;
    }
}
