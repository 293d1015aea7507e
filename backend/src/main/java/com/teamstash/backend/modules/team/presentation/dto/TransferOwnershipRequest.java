package com.teamstash.backend.modules.team.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record TransferOwnershipRequest(@NotNull UUID memberId) {
}
