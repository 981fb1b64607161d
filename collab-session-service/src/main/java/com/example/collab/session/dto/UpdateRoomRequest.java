package com.example.collab.session.dto;

import com.example.collab.session.model.RoomSettings;
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
public class UpdateRoomRequest {
    private String name;
    private Map<String, Object> data;
    @Positive(message = "maxParticipants must be positive")
    private Integer maxParticipants;
    private Boolean locked;
    private RoomSettings settings;
}
