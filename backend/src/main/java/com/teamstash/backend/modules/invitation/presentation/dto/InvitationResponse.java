package com.teamstash.backend.modules.invitation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.teamstash.backend.modules.invitation.domain.InvitationStatus;
import com.teamstash.backend.modules.invitation.domain.TeamInvitation;
import com.teamstash.backend.modules.team.domain.Team;
import com.teamstash.backend.modules.team.domain.TeamRole;

public record InvitationResponse(
        UUID invitationId,
        UUID teamId,
        String teamName,
        String email,
        TeamRole role,
        InvitationStatus status,
        UUID invitedBy,
        OffsetDateTime createdAt,
        OffsetDateTime resolvedAt
) {

    public static InvitationResponse from(TeamInvitation invitation) {
        Team team = invitation.getTeam();
        return new InvitationResponse(
                invitation.getId(),
                team != null ? team.getId() : null,
                team != null ? team.getName() : null,
                invitation.getEmailInvited(),
                invitation.getRole(),
                invitation.getStatus(),
                invitation.getInvitedBy(),
                invitation.getCreatedAt(),
                invitation.getResolvedAt()
        );
    }
}
