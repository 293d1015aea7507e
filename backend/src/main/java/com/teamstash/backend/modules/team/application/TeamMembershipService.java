package com.teamstash.backend.modules.team.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.account.application.AccountService;
import com.teamstash.backend.modules.account.domain.AppUser;
import com.teamstash.backend.modules.account.infrastructure.persistence.AppUserRepository;
import com.teamstash.backend.modules.team.domain.Team;
import com.teamstash.backend.modules.team.domain.TeamCapability;
import com.teamstash.backend.modules.team.domain.TeamMembership;
import com.teamstash.backend.modules.team.domain.TeamMembershipId;
import com.teamstash.backend.modules.team.domain.TeamRole;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamRepository;
import com.teamstash.backend.modules.team.presentation.dto.TeamMemberResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Direct membership management: listing, admin adds, role changes, removal and leaving.
 * Every path that can take an admin away locks the team row first and keeps at least one admin.
 */
@Service
@Transactional
public class TeamMembershipService {

    private static final Logger log = LoggerFactory.getLogger(TeamMembershipService.class);

    private final TeamRepository teamRepository;
    private final TeamMembershipRepository teamMembershipRepository;
    private final AppUserRepository appUserRepository;
    private final TeamRoleAuthorizer authorizer;
    private final Clock clock;

    public TeamMembershipService(
            TeamRepository teamRepository,
            TeamMembershipRepository teamMembershipRepository,
            AppUserRepository appUserRepository,
            TeamRoleAuthorizer authorizer,
            Clock clock
    ) {
        this.teamRepository = teamRepository;
        this.teamMembershipRepository = teamMembershipRepository;
        this.appUserRepository = appUserRepository;
        this.authorizer = authorizer;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TeamMemberResponse> listMembers(UUID teamId, UUID principalId) {
        authorizer.require(teamId, principalId, TeamCapability.READ_DATA);
        Team team = findTeam(teamId);
        return describeMembers(team);
    }

    @Transactional(readOnly = true)
    public List<TeamMemberResponse> describeMembers(Team team) {
        List<TeamMembership> memberships = teamMembershipRepository.findAllByTeamId(team.getId());
        Map<UUID, AppUser> accounts = appUserRepository.findByIdIn(
                        memberships.stream().map(TeamMembership::getMemberId).toList())
                .stream()
                .collect(Collectors.toMap(AppUser::getId, Function.identity()));
        return memberships.stream()
                .map(membership -> toResponse(team, membership, accounts.get(membership.getMemberId())))
                .toList();
    }

    public TeamMemberResponse addMember(UUID teamId, UUID principalId, String rawEmail, TeamRole role) {
        authorizer.require(teamId, principalId, TeamCapability.MANAGE_TEAM);
        Team team = findTeam(teamId);
        String email = AccountService.normalizeEmail(rawEmail);

        List<UUID> accountIds = appUserRepository.findVerifiedIdsByEmail(email);
        if (accountIds.isEmpty()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "team.account_not_found",
                    "No verified account is registered for " + email + ". Send an invitation instead.")
                    .withRejectedInput(Map.of("email", email, "role", role));
        }
        if (accountIds.size() > 1) {
            throw new ProblemException(HttpStatus.CONFLICT, "team.account_ambiguous",
                    "Several accounts use " + email + ". Send an invitation instead.")
                    .withRejectedInput(Map.of("email", email, "role", role));
        }
        UUID memberId = accountIds.get(0);

        int inserted = teamMembershipRepository.insertIfAbsent(teamId, memberId, role.name(), OffsetDateTime.now(clock));
        if (inserted == 0) {
            throw new ProblemException(HttpStatus.CONFLICT, "team.already_member", email + " is already a member of this team.")
                    .withRejectedInput(Map.of("email", email, "role", role));
        }

        log.info("Member added teamId={} memberId={} role={} by={}", teamId, memberId, role, principalId);
        TeamMembership membership = findMembership(teamId, memberId);
        return toResponse(team, membership, appUserRepository.findById(memberId).orElse(null));
    }

    public TeamMemberResponse changeRole(UUID teamId, UUID principalId, UUID memberId, TeamRole newRole) {
        authorizer.require(teamId, principalId, TeamCapability.MANAGE_TEAM);
        Team team = lockTeam(teamId);
        TeamMembership membership = findMembership(teamId, memberId);

        if (membership.getRole() == newRole) {
            return toResponse(team, membership, appUserRepository.findById(memberId).orElse(null));
        }
        if (membership.getRole() == TeamRole.ADMIN) {
            if (team.isOwnedBy(memberId)) {
                throw ownerMustTransfer();
            }
            ensureAnotherAdminRemains(teamId);
        }

        membership.changeRole(newRole);
        log.info("Member role changed teamId={} memberId={} role={} by={}", teamId, memberId, newRole, principalId);
        return toResponse(team, membership, appUserRepository.findById(memberId).orElse(null));
    }

    /**
     * Removes a member. Admins may remove anyone; any member may remove themselves (leave).
     */
    public void removeMember(UUID teamId, UUID principalId, UUID memberId) {
        boolean leaving = principalId.equals(memberId);
        authorizer.require(teamId, principalId, leaving ? TeamCapability.READ_DATA : TeamCapability.MANAGE_TEAM);
        Team team = lockTeam(teamId);
        TeamMembership membership = findMembership(teamId, memberId);

        if (team.isOwnedBy(memberId)) {
            throw ownerMustTransfer();
        }
        if (membership.getRole() == TeamRole.ADMIN) {
            ensureAnotherAdminRemains(teamId);
        }

        teamMembershipRepository.delete(membership);
        log.info("Member removed teamId={} memberId={} by={} leaving={}", teamId, memberId, principalId, leaving);
    }

    private void ensureAnotherAdminRemains(UUID teamId) {
        if (teamMembershipRepository.countByTeamIdAndRole(teamId, TeamRole.ADMIN) <= 1) {
            throw new ProblemException(HttpStatus.CONFLICT, "team.last_admin",
                    "A team must keep at least one admin. Promote another member first.");
        }
    }

    private Team lockTeam(UUID teamId) {
        return teamRepository.findByIdForUpdate(teamId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found."));
    }

    private Team findTeam(UUID teamId) {
        return teamRepository.findById(teamId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found."));
    }

    private TeamMembership findMembership(UUID teamId, UUID memberId) {
        return teamMembershipRepository.findById(new TeamMembershipId(teamId, memberId))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.member_not_found", "Member not found."));
    }

    private static ProblemException ownerMustTransfer() {
        return new ProblemException(HttpStatus.CONFLICT, "team.owner_must_transfer",
                "The team owner must transfer ownership or delete the team first.");
    }

    private static TeamMemberResponse toResponse(Team team, TeamMembership membership, AppUser account) {
        return new TeamMemberResponse(
                membership.getMemberId(),
                account != null ? account.getEmail() : null,
                account != null ? account.getDisplayName() : null,
                membership.getRole(),
                team.isOwnedBy(membership.getMemberId()),
                membership.getJoinedAt()
        );
    }
}
