package com.example.collab.session.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomSettings {
    @Builder.Default
    private boolean allowAnonymous = false;
    @Builder.Default
    private boolean requireAuth = true;
    @Builder.Default
    private boolean autoSave = true;
    @Builder.Default
    private boolean versionHistory = true;
}
