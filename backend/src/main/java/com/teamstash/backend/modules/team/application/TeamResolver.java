package com.teamstash.backend.modules.team.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamMembership;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Chooses the team a request operates against. Performs no writes; persisting a changed
 * preference is left to the caller.
 */
@Service
@Transactional(readOnly = true)
public class TeamResolver {

    private final TeamMembershipRepository teamMembershipRepository;

    public TeamResolver(TeamMembershipRepository teamMembershipRepository) {
        this.teamMembershipRepository = teamMembershipRepository;
    }

    /**
     * @param storedPreference opaque client-held token naming the previously chosen team, may be null
     * @return empty when the principal belongs to no team (onboarding, not an authorization failure)
     */
    public Optional<ActiveTeamResolution> resolveActiveTeam(UUID principalId, String storedPreference) {
        List<TeamMembership> memberships = teamMembershipRepository.findAllByMemberIdWithTeam(principalId);
        if (memberships.isEmpty()) {
            return Optional.empty();
        }

        Optional<UUID> preferredTeamId = parsePreference(storedPreference);
        if (preferredTeamId.isPresent()) {
            UUID preferred = preferredTeamId.get();
            for (TeamMembership membership : memberships) {
                if (membership.getId().getTeamId().equals(preferred)) {
                    return Optional.of(new ActiveTeamResolution(toActiveTeam(membership), false));
                }
            }
        }

        // Absent or stale preference: fall back to the oldest membership and ask the caller to remember it
        return Optional.of(new ActiveTeamResolution(toActiveTeam(memberships.get(0)), true));
    }

    static Optional<UUID> parsePreference(String storedPreference) {
        if (storedPreference == null || storedPreference.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(storedPreference.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    private static ActiveTeam toActiveTeam(TeamMembership membership) {
        return new ActiveTeam(
                membership.getId().getTeamId(),
                membership.getTeam().getName(),
                membership.getRole()
        );
    }
}
