package com.teamstash.backend.modules.team.presentation.dto;

import com.teamstash.backend.modules.team.domain.TeamRole;

import jakarta.validation.constraints.NotNull;

public record UpdateMemberRoleRequest(@NotNull TeamRole role) {
}
