package com.teamstash.backend.modules.team.application;

import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamCapability;
import com.teamstash.backend.modules.team.domain.TeamRole;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single place where team roles are turned into allow/deny decisions.
 *
 * <p>Denials on reads are reported as {@code team.not_found} so that non-members cannot probe
 * for team existence; denials on writes are reported as {@code team.forbidden} whether the caller
 * is a non-member or a member with an insufficient role.</p>
 */
@Service
@Transactional(readOnly = true)
public class TeamRoleAuthorizer {

    private final TeamMembershipRepository teamMembershipRepository;

    public TeamRoleAuthorizer(TeamMembershipRepository teamMembershipRepository) {
        this.teamMembershipRepository = teamMembershipRepository;
    }

    public Optional<TeamRole> roleOf(UUID teamId, UUID principalId) {
        if (teamId == null || principalId == null) {
            return Optional.empty();
        }
        return teamMembershipRepository.findRole(teamId, principalId);
    }

    public boolean authorize(Optional<TeamRole> role, TeamCapability capability) {
        return TeamRole.permits(role, capability);
    }

    /**
     * Loads the caller's role in {@code teamId} and fails unless it grants {@code capability}.
     */
    public TeamRole require(UUID teamId, UUID principalId, TeamCapability capability) {
        Optional<TeamRole> role = roleOf(teamId, principalId);
        if (!authorize(role, capability)) {
            throw denied(capability);
        }
        return role.get();
    }

    /**
     * Checks the role already resolved for this request's active team.
     */
    public void require(ActiveTeam activeTeam, TeamCapability capability) {
        if (!authorize(Optional.of(activeTeam.role()), capability)) {
            throw denied(capability);
        }
    }

    private static ProblemException denied(TeamCapability capability) {
        if (capability == TeamCapability.READ_DATA) {
            return new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found.");
        }
        return new ProblemException(HttpStatus.FORBIDDEN, "team.forbidden",
                "You do not have permission to perform this action.");
    }
}
