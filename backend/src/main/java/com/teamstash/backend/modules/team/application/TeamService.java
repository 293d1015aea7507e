package com.teamstash.backend.modules.team.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.Team;
import com.teamstash.backend.modules.team.domain.TeamCapability;
import com.teamstash.backend.modules.team.domain.TeamMembership;
import com.teamstash.backend.modules.team.domain.TeamMembershipId;
import com.teamstash.backend.modules.team.domain.TeamRole;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamRepository;
import com.teamstash.backend.modules.team.presentation.dto.TeamDetailResponse;
import com.teamstash.backend.modules.team.presentation.dto.TeamSummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TeamService {

    static final int MIN_NAME_LENGTH = 3;
    static final int MAX_NAME_LENGTH = 100;

    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    private final TeamRepository teamRepository;
    private final TeamMembershipRepository teamMembershipRepository;
    private final TeamRoleAuthorizer authorizer;
    private final TeamMembershipService teamMembershipService;
    private final Clock clock;

    public TeamService(
            TeamRepository teamRepository,
            TeamMembershipRepository teamMembershipRepository,
            TeamRoleAuthorizer authorizer,
            TeamMembershipService teamMembershipService,
            Clock clock
    ) {
        this.teamRepository = teamRepository;
        this.teamMembershipRepository = teamMembershipRepository;
        this.authorizer = authorizer;
        this.teamMembershipService = teamMembershipService;
        this.clock = clock;
    }

    /**
     * Creates the team and enrols the creator as its first admin. Both rows commit together or not at all.
     */
    public TeamSummaryResponse createTeam(UUID ownerId, String rawName) {
        String name = normalizeName(rawName);
        if (teamRepository.existsByOwnerIdAndNameIgnoreCase(ownerId, name)) {
            throw nameConflict(name);
        }

        Team team;
        try {
            team = teamRepository.saveAndFlush(new Team(name, ownerId));
        } catch (DataIntegrityViolationException ex) {
            throw nameConflict(name);
        }

        TeamMembership membership = teamMembershipRepository.saveAndFlush(
                new TeamMembership(team, ownerId, TeamRole.ADMIN, OffsetDateTime.now(clock)));

        log.info("Team created teamId={} ownerId={}", team.getId(), ownerId);
        return toSummary(membership, ownerId);
    }

    @Transactional(readOnly = true)
    public List<TeamSummaryResponse> listTeams(UUID principalId) {
        return teamMembershipRepository.findAllByMemberIdWithTeam(principalId).stream()
                .map(membership -> toSummary(membership, principalId))
                .toList();
    }

    @Transactional(readOnly = true)
    public TeamDetailResponse getTeam(UUID teamId, UUID principalId) {
        TeamRole myRole = authorizer.require(teamId, principalId, TeamCapability.READ_DATA);
        Team team = findTeam(teamId);
        return new TeamDetailResponse(
                team.getId(),
                team.getName(),
                team.getOwnerId(),
                myRole,
                team.getCreatedAt(),
                team.getUpdatedAt(),
                teamMembershipService.describeMembers(team)
        );
    }

    public TeamSummaryResponse renameTeam(UUID teamId, UUID principalId, String rawName) {
        authorizer.require(teamId, principalId, TeamCapability.MANAGE_TEAM);
        String name = normalizeName(rawName);
        Team team = findTeam(teamId);
        if (teamRepository.existsByOwnerIdAndNameIgnoreCaseAndIdNot(team.getOwnerId(), name, teamId)) {
            throw nameConflict(name);
        }
        team.setName(name);
        try {
            teamRepository.saveAndFlush(team);
        } catch (DataIntegrityViolationException ex) {
            throw nameConflict(name);
        }
        TeamMembership membership = teamMembershipRepository.findById(new TeamMembershipId(teamId, principalId))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found."));
        return toSummary(membership, principalId);
    }

    /**
     * Deletes the team. Memberships, invitations and every team-scoped record go with it.
     */
    public void deleteTeam(UUID teamId, UUID principalId) {
        authorizer.require(teamId, principalId, TeamCapability.MANAGE_TEAM);
        Team team = teamRepository.findByIdForUpdate(teamId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found."));
        if (!team.isOwnedBy(principalId)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "team.owner_only", "Only the team owner can delete the team.");
        }
        teamRepository.delete(team);
        log.info("Team deleted teamId={} principalId={}", teamId, principalId);
    }

    public void transferOwnership(UUID teamId, UUID principalId, UUID newOwnerId) {
        authorizer.require(teamId, principalId, TeamCapability.MANAGE_TEAM);
        Team team = teamRepository.findByIdForUpdate(teamId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found."));
        if (!team.isOwnedBy(principalId)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "team.owner_only", "Only the team owner can transfer ownership.");
        }
        if (team.isOwnedBy(newOwnerId)) {
            return;
        }
        TeamRole targetRole = authorizer.roleOf(teamId, newOwnerId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.member_not_found", "Member not found."));
        if (targetRole != TeamRole.ADMIN) {
            throw new ProblemException(HttpStatus.CONFLICT, "team.owner_must_be_admin",
                    "Ownership can only be transferred to an admin of the team.")
                    .withRejectedInput(Map.of("memberId", newOwnerId));
        }
        team.setOwnerId(newOwnerId);
        log.info("Team ownership transferred teamId={} from={} to={}", teamId, principalId, newOwnerId);
    }

    /**
     * Explicit selection of the active team. Only teams the caller belongs to can be selected.
     */
    @Transactional(readOnly = true)
    public ActiveTeam selectActiveTeam(UUID principalId, UUID teamId) {
        TeamMembership membership = teamMembershipRepository.findById(new TeamMembershipId(teamId, principalId))
                .orElseThrow(() -> new ProblemException(HttpStatus.FORBIDDEN, "team.forbidden",
                        "You are not a member of this team."));
        return new ActiveTeam(teamId, membership.getTeam().getName(), membership.getRole());
    }

    static String normalizeName(String rawName) {
        String name = rawName == null ? "" : rawName.trim();
        if (name.length() < MIN_NAME_LENGTH || name.length() > MAX_NAME_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "team.invalid_name",
                    "Team name must be between " + MIN_NAME_LENGTH + " and " + MAX_NAME_LENGTH + " characters.")
                    .withRejectedInput(Map.of("name", rawName == null ? "" : rawName));
        }
        return name;
    }

    private Team findTeam(UUID teamId) {
        return teamRepository.findById(teamId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found."));
    }

    private static ProblemException nameConflict(String name) {
        return new ProblemException(HttpStatus.CONFLICT, "team.name_conflict",
                "You already own a team named \"" + name + "\".")
                .withRejectedInput(Map.of("name", name));
    }

    private static TeamSummaryResponse toSummary(TeamMembership membership, UUID principalId) {
        Team team = membership.getTeam();
        return new TeamSummaryResponse(
                team.getId(),
                team.getName(),
                membership.getRole(),
                team.isOwnedBy(principalId),
                membership.getJoinedAt(),
                team.getCreatedAt()
        );
    }
}
