package com.teamstash.backend.modules.team.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.teamstash.backend.modules.team.domain.TeamRole;

public record TeamMemberResponse(
        UUID memberId,
        String email,
        String displayName,
        TeamRole role,
        boolean owner,
        OffsetDateTime joinedAt
) {
}
