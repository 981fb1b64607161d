package com.example.collab.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollaborationState {
    @Builder.Default
    private List<String> roomIds = new ArrayList<>();
    private int activeCount;
    private long lastCollaborationAt;
}
