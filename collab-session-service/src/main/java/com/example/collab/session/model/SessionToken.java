package com.example.collab.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token record written by the auth service under {@code token:<token>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionToken {
    private String sessionId;
    private String userId;
    private long expiresAt;
}
