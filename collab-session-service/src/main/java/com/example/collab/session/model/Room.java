package com.example.collab.session.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Room {
    private String id;
    private String name;
    @Builder.Default
    private RoomKind kind = RoomKind.DOCUMENT;
    private String ownerUserId;
    @Builder.Default
    private List<Participant> participants = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
    private long createdAt;
    private long lastActivityAt;
    @Builder.Default
    private int maxParticipants = 10;
    private boolean locked;
    @Builder.Default
    private RoomSettings settings = new RoomSettings();

    @JsonIgnore
    public Optional<Participant> participant(String connectionId) {
        return participants.stream()
                .filter(p -> p.getConnectionId().equals(connectionId))
                .findFirst();
    }

    @JsonIgnore
    public boolean isFull() {
        return participants.size() >= maxParticipants;
    }
}
