package com.example.collab.session.dto;

import com.example.collab.session.model.RoomKind;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRoomRequest {
    private String name;
    private RoomKind type;
    private String ownerId;
    private Map<String, Object> initialData;
    @Positive(message = "maxParticipants must be positive")
    private Integer maxParticipants;
    private Boolean allowAnonymous;
    private Boolean requireAuth;
    private Boolean autoSave;
    private Boolean versionHistory;
}
