package com.teamstash.backend.modules.team.presentation.dto;

import java.util.UUID;

import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamRole;

public record ActiveTeamResponse(
        UUID teamId,
        String name,
        TeamRole role,
        boolean canManageTeam,
        boolean canMutateData
) {

    public static ActiveTeamResponse from(ActiveTeam activeTeam) {
        TeamRole role = activeTeam.role();
        return new ActiveTeamResponse(
                activeTeam.teamId(),
                activeTeam.teamName(),
                role,
                role.canManageTeam(),
                role.canMutateData()
        );
    }
}
