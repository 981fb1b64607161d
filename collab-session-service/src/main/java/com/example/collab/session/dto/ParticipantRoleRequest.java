package com.example.collab.session.dto;

import com.example.collab.session.model.ParticipantRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantRoleRequest {
    @NotBlank(message = "connectionId is required")
    private String connectionId;
    @NotNull(message = "role is required")
    private ParticipantRole role;
}
