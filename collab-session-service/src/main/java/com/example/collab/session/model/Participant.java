package com.example.collab.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Participant {
    private String userId;
    private String connectionId;
    private long joinedAt;
    private ParticipantRole role;
    @Builder.Default
    private Set<String> permissions = new LinkedHashSet<>();
}
