package com.teamstash.backend.modules.team.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record SelectActiveTeamRequest(@NotNull UUID teamId) {
}
