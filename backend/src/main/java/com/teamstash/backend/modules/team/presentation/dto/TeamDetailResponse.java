package com.teamstash.backend.modules.team.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.teamstash.backend.modules.team.domain.TeamRole;

public record TeamDetailResponse(
        UUID teamId,
        String name,
        UUID ownerId,
        TeamRole myRole,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        List<TeamMemberResponse> members
) {
}
