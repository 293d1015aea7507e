package com.teamstash.backend.modules.team.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RenameTeamRequest(
        @NotBlank @Size(max = 100) String name
) {
}
