package com.example.collab.shared.user;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRecord {
    private String id;
    private String email;
    private String displayName;
    private SubscriptionTier subscriptionTier;
    private OffsetDateTime createdAt;
}
