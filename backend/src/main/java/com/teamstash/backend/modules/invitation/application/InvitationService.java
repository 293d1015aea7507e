package com.teamstash.backend.modules.invitation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.account.application.AccountService;
import com.teamstash.backend.modules.account.domain.AppUser;
import com.teamstash.backend.modules.account.infrastructure.persistence.AppUserRepository;
import com.teamstash.backend.modules.invitation.domain.InvitationStatus;
import com.teamstash.backend.modules.invitation.domain.TeamInvitation;
import com.teamstash.backend.modules.invitation.infrastructure.persistence.TeamInvitationRepository;
import com.teamstash.backend.modules.invitation.presentation.dto.InvitationResponse;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.Team;
import com.teamstash.backend.modules.team.domain.TeamCapability;
import com.teamstash.backend.modules.team.domain.TeamMembershipId;
import com.teamstash.backend.modules.team.domain.TeamRole;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Invitation lifecycle: {@code PENDING -> ACCEPTED} or {@code PENDING -> DECLINED}, nothing else.
 *
 * <p>Only the principal whose verified account email matches the invited address may resolve an
 * invitation. Repeating the transition that already happened is a no-op; attempting the opposite
 * one is a conflict.</p>
 */
@Service
@Transactional
public class InvitationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

    private final TeamInvitationRepository invitationRepository;
    private final TeamRepository teamRepository;
    private final TeamMembershipRepository teamMembershipRepository;
    private final AppUserRepository appUserRepository;
    private final TeamRoleAuthorizer authorizer;
    private final Clock clock;

    public InvitationService(
            TeamInvitationRepository invitationRepository,
            TeamRepository teamRepository,
            TeamMembershipRepository teamMembershipRepository,
            AppUserRepository appUserRepository,
            TeamRoleAuthorizer authorizer,
            Clock clock
    ) {
        this.invitationRepository = invitationRepository;
        this.teamRepository = teamRepository;
        this.teamMembershipRepository = teamMembershipRepository;
        this.appUserRepository = appUserRepository;
        this.authorizer = authorizer;
        this.clock = clock;
    }

    public InvitationResponse createInvitation(UUID teamId, UUID inviterId, String rawEmail, TeamRole role) {
        authorizer.require(teamId, inviterId, TeamCapability.MANAGE_TEAM);
        if (role == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "invitation.invalid_role",
                    "A role must be one of ADMIN, EDITOR or VIEWER.");
        }
        String email = AccountService.normalizeEmail(rawEmail);
        Map<String, Object> rejected = Map.of("email", email == null ? "" : email, "role", role);
        if (email == null || email.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "invitation.invalid_email",
                    "An email address is required.").withRejectedInput(rejected);
        }

        AppUser inviter = requireAccount(inviterId);
        if (email.equalsIgnoreCase(inviter.getEmail())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "invitation.self_invite", "You cannot invite yourself.")
                    .withRejectedInput(rejected);
        }

        boolean alreadyMember = appUserRepository.findVerifiedIdsByEmail(email).stream()
                .anyMatch(accountId -> teamMembershipRepository.existsById(new TeamMembershipId(teamId, accountId)));
        if (alreadyMember) {
            throw new ProblemException(HttpStatus.CONFLICT, "invitation.already_member",
                    email + " is already a member of this team.").withRejectedInput(rejected);
        }

        if (invitationRepository.existsPending(teamId, email)) {
            throw duplicatePending(email, rejected);
        }

        Team team = teamRepository.findById(teamId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "team.not_found", "Team not found."));
        TeamInvitation invitation;
        try {
            invitation = invitationRepository.saveAndFlush(
                    new TeamInvitation(team, email, inviterId, role, OffsetDateTime.now(clock)));
        } catch (DataIntegrityViolationException ex) {
            // Lost a race against another invitation for the same address
            throw duplicatePending(email, rejected);
        }

        log.info("Invitation created invitationId={} teamId={} role={} by={}", invitation.getId(), teamId, role, inviterId);
        return InvitationResponse.from(invitation);
    }

    @Transactional(readOnly = true)
    public List<InvitationResponse> listTeamInvitations(UUID teamId, UUID principalId, InvitationStatus status) {
        authorizer.require(teamId, principalId, TeamCapability.MANAGE_TEAM);
        List<TeamInvitation> invitations = status == null
                ? invitationRepository.findByTeamId(teamId)
                : invitationRepository.findByTeamIdAndStatus(teamId, status);
        return invitations.stream().map(InvitationResponse::from).toList();
    }

    /**
     * Pending invitations addressed to the caller. Nothing is listed until the caller's email is verified.
     */
    @Transactional(readOnly = true)
    public List<InvitationResponse> listMyPendingInvitations(UUID principalId) {
        AppUser account = requireAccount(principalId);
        if (!account.isEmailVerified()) {
            return List.of();
        }
        return invitationRepository.findPendingByEmail(AccountService.normalizeEmail(account.getEmail())).stream()
                .map(InvitationResponse::from)
                .toList();
    }

    public InvitationResponse acceptInvitation(UUID invitationId, UUID accepterId) {
        AppUser account = requireAccount(accepterId);
        TeamInvitation invitation = loadOwnInvitation(invitationId, account);

        if (isRepeatOf(invitation, InvitationStatus.ACCEPTED, accepterId)) {
            return InvitationResponse.from(invitation);
        }
        if (invitation.getStatus().isTerminal()) {
            throw alreadyResolved(invitation);
        }
        requireLiveTeam(invitation, accepterId);

        OffsetDateTime now = OffsetDateTime.now(clock);
        UUID teamId = invitation.getTeam().getId();
        int inserted;
        try {
            inserted = teamMembershipRepository.insertIfAbsent(teamId, accepterId, invitation.getRole().name(), now);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Invitation accept failed, team no longer available invitationId={} teamId={} principalId={}",
                    invitationId, teamId, accepterId);
            throw noLongerValid();
        }
        if (inserted == 0) {
            log.info("Invitation accepted by an existing member invitationId={} teamId={} principalId={}",
                    invitationId, teamId, accepterId);
        }

        invitation.accept(accepterId, now);
        log.info("Invitation accepted invitationId={} teamId={} principalId={}", invitationId, teamId, accepterId);
        return InvitationResponse.from(invitation);
    }

    public InvitationResponse declineInvitation(UUID invitationId, UUID declinerId) {
        AppUser account = requireAccount(declinerId);
        TeamInvitation invitation = loadOwnInvitation(invitationId, account);

        if (isRepeatOf(invitation, InvitationStatus.DECLINED, declinerId)) {
            return InvitationResponse.from(invitation);
        }
        if (invitation.getStatus().isTerminal()) {
            throw alreadyResolved(invitation);
        }
        requireLiveTeam(invitation, declinerId);

        invitation.decline(declinerId, OffsetDateTime.now(clock));
        log.info("Invitation declined invitationId={} teamId={} principalId={}",
                invitationId, invitation.getTeam().getId(), declinerId);
        return InvitationResponse.from(invitation);
    }

    /**
     * Locks the invitation and checks it is addressed to the caller's account. Invitations for other
     * addresses are reported as missing.
     */
    private TeamInvitation loadOwnInvitation(UUID invitationId, AppUser account) {
        TeamInvitation invitation = invitationRepository.findByIdForUpdate(invitationId)
                .filter(candidate -> candidate.getEmailInvited().equalsIgnoreCase(account.getEmail()))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "invitation.not_found",
                        "Invitation not found or no longer valid."));
        if (!account.isEmailVerified()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "invitation.email_unverified",
                    "Verify your email address before responding to invitations.");
        }
        return invitation;
    }

    private static void requireLiveTeam(TeamInvitation invitation, UUID principalId) {
        if (invitation.isTeamGone()) {
            log.info("Invitation response rejected, team deleted invitationId={} principalId={}",
                    invitation.getId(), principalId);
            throw noLongerValid();
        }
    }

    private static ProblemException noLongerValid() {
        return new ProblemException(HttpStatus.GONE, "invitation.no_longer_valid", "This invitation is no longer valid.");
    }

    private static boolean isRepeatOf(TeamInvitation invitation, InvitationStatus status, UUID principalId) {
        return invitation.getStatus() == status && principalId.equals(invitation.getResolvedBy());
    }

    private AppUser requireAccount(UUID principalId) {
        return appUserRepository.findById(principalId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "account.not_found",
                        "No account is registered for the current principal."));
    }

    private static ProblemException duplicatePending(String email, Map<String, Object> rejected) {
        return new ProblemException(HttpStatus.CONFLICT, "invitation.duplicate_pending",
                "A pending invitation for " + email + " already exists.").withRejectedInput(rejected);
    }

    private static ProblemException alreadyResolved(TeamInvitation invitation) {
        return new ProblemException(HttpStatus.CONFLICT, "invitation.already_resolved",
                "This invitation has already been " + invitation.getStatus().name().toLowerCase() + ".");
    }
}
