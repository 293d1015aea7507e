package com.teamstash.backend.modules.team.presentation.dto;

import com.teamstash.backend.modules.team.domain.TeamRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AddMemberRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @NotNull TeamRole role
) {
}
