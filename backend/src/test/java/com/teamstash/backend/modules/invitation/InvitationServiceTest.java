package com.teamstash.backend.modules.invitation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.account.domain.AppUser;
import com.teamstash.backend.modules.account.infrastructure.persistence.AppUserRepository;
import com.teamstash.backend.modules.invitation.application.InvitationService;
import com.teamstash.backend.modules.invitation.domain.InvitationStatus;
import com.teamstash.backend.modules.invitation.domain.TeamInvitation;
import com.teamstash.backend.modules.invitation.infrastructure.persistence.TeamInvitationRepository;
import com.teamstash.backend.modules.invitation.presentation.dto.InvitationResponse;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.Team;
import com.teamstash.backend.modules.team.domain.TeamMembershipId;
import com.teamstash.backend.modules.team.domain.TeamRole;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class InvitationServiceTest {

    private static final UUID TEAM_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID INVITATION_ID = UUID.fromString("00000000-0000-0000-0000-00000000c001");
    private static final UUID ALICE_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");
    private static final UUID BOB_ID = UUID.fromString("00000000-0000-0000-0000-00000000b002");
    private static final UUID MALLORY_ID = UUID.fromString("00000000-0000-0000-0000-00000000b003");

    @Mock
    private TeamInvitationRepository invitationRepository;

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private TeamMembershipRepository teamMembershipRepository;

    @Mock
    private AppUserRepository appUserRepository;

    private InvitationService invitationService;
    private Team team;
    private AppUser alice;
    private AppUser bob;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        invitationService = new InvitationService(
                invitationRepository,
                teamRepository,
                teamMembershipRepository,
                appUserRepository,
                new TeamRoleAuthorizer(teamMembershipRepository),
                clock
        );
        team = new Team("Groceries", ALICE_ID);
        ReflectionTestUtils.setField(team, "id", TEAM_ID);
        alice = new AppUser(ALICE_ID, "alice@example.com", true, "Alice");
        bob = new AppUser(BOB_ID, "bob@example.com", true, "Bob");
    }

    @Test
    void adminInvitesByNormalisedEmail() {
        givenAdminAlice();
        when(appUserRepository.findById(ALICE_ID)).thenReturn(Optional.of(alice));
        when(appUserRepository.findVerifiedIdsByEmail("bob@example.com")).thenReturn(List.of());
        when(invitationRepository.existsPending(TEAM_ID, "bob@example.com")).thenReturn(false);
        when(teamRepository.findById(TEAM_ID)).thenReturn(Optional.of(team));
        when(invitationRepository.saveAndFlush(any(TeamInvitation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        InvitationResponse response = invitationService.createInvitation(TEAM_ID, ALICE_ID, "  Bob@Example.COM ", TeamRole.EDITOR);

        assertThat(response.email()).isEqualTo("bob@example.com");
        assertThat(response.role()).isEqualTo(TeamRole.EDITOR);
        assertThat(response.status()).isEqualTo(InvitationStatus.PENDING);
        assertThat(response.teamName()).isEqualTo("Groceries");
        assertThat(response.invitedBy()).isEqualTo(ALICE_ID);
    }

    @Test
    void nonAdminCannotInvite() {
        when(teamMembershipRepository.findRole(TEAM_ID, BOB_ID)).thenReturn(Optional.of(TeamRole.EDITOR));

        assertThatThrownBy(() -> invitationService.createInvitation(TEAM_ID, BOB_ID, "carol@example.com", TeamRole.VIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("team.forbidden");
                });
        verify(invitationRepository, never()).saveAndFlush(any(TeamInvitation.class));
    }

    @Test
    void selfInviteIsRejected() {
        givenAdminAlice();
        when(appUserRepository.findById(ALICE_ID)).thenReturn(Optional.of(alice));

        assertThatThrownBy(() -> invitationService.createInvitation(TEAM_ID, ALICE_ID, "ALICE@example.com", TeamRole.VIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("invitation.self_invite");
                });
    }

    @Test
    void invitingExistingMemberIsConflict() {
        givenAdminAlice();
        when(appUserRepository.findById(ALICE_ID)).thenReturn(Optional.of(alice));
        when(appUserRepository.findVerifiedIdsByEmail("bob@example.com")).thenReturn(List.of(BOB_ID));
        when(teamMembershipRepository.existsById(new TeamMembershipId(TEAM_ID, BOB_ID))).thenReturn(true);

        assertThatThrownBy(() -> invitationService.createInvitation(TEAM_ID, ALICE_ID, "bob@example.com", TeamRole.VIEWER))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "invitation.already_member");
    }

    @Test
    void addressSharedByVerifiedAccountsIsMemberIfAnyOfThemIs() {
        givenAdminAlice();
        when(appUserRepository.findById(ALICE_ID)).thenReturn(Optional.of(alice));
        when(appUserRepository.findVerifiedIdsByEmail("bob@example.com")).thenReturn(List.of(MALLORY_ID, BOB_ID));
        when(teamMembershipRepository.existsById(new TeamMembershipId(TEAM_ID, MALLORY_ID))).thenReturn(false);
        when(teamMembershipRepository.existsById(new TeamMembershipId(TEAM_ID, BOB_ID))).thenReturn(true);

        assertThatThrownBy(() -> invitationService.createInvitation(TEAM_ID, ALICE_ID, "bob@example.com", TeamRole.VIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("invitation.already_member");
                });
    }

    @Test
    void secondPendingInvitationIsConflict() {
        givenAdminAlice();
        when(appUserRepository.findById(ALICE_ID)).thenReturn(Optional.of(alice));
        when(appUserRepository.findVerifiedIdsByEmail("bob@example.com")).thenReturn(List.of());
        when(invitationRepository.existsPending(TEAM_ID, "bob@example.com")).thenReturn(true);

        assertThatThrownBy(() -> invitationService.createInvitation(TEAM_ID, ALICE_ID, "bob@example.com", TeamRole.VIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("invitation.duplicate_pending");
                    assertThat(ex.getRejectedInput()).containsEntry("email", "bob@example.com");
                });
    }

    @Test
    void concurrentDuplicateCaughtByIndexIsConflict() {
        givenAdminAlice();
        when(appUserRepository.findById(ALICE_ID)).thenReturn(Optional.of(alice));
        when(appUserRepository.findVerifiedIdsByEmail("bob@example.com")).thenReturn(List.of());
        when(invitationRepository.existsPending(TEAM_ID, "bob@example.com")).thenReturn(false);
        when(teamRepository.findById(TEAM_ID)).thenReturn(Optional.of(team));
        when(invitationRepository.saveAndFlush(any(TeamInvitation.class)))
                .thenThrow(new DataIntegrityViolationException("uq_team_invitation_pending"));

        assertThatThrownBy(() -> invitationService.createInvitation(TEAM_ID, ALICE_ID, "bob@example.com", TeamRole.VIEWER))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "invitation.duplicate_pending");
    }

    @Test
    void acceptCreatesMembershipWithInvitedRole() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.EDITOR);
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(bob));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));
        when(teamMembershipRepository.insertIfAbsent(eq(TEAM_ID), eq(BOB_ID), eq("EDITOR"), any(OffsetDateTime.class)))
                .thenReturn(1);

        InvitationResponse response = invitationService.acceptInvitation(INVITATION_ID, BOB_ID);

        assertThat(response.status()).isEqualTo(InvitationStatus.ACCEPTED);
        assertThat(invitation.getResolvedBy()).isEqualTo(BOB_ID);
        assertThat(invitation.getResolvedAt()).isEqualTo(OffsetDateTime.parse("2025-03-01T09:00:00Z"));
    }

    @Test
    void repeatedAcceptIsNoop() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.EDITOR);
        invitation.accept(BOB_ID, OffsetDateTime.parse("2025-02-01T00:00:00Z"));
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(bob));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));

        InvitationResponse response = invitationService.acceptInvitation(INVITATION_ID, BOB_ID);

        assertThat(response.status()).isEqualTo(InvitationStatus.ACCEPTED);
        assertThat(invitation.getResolvedAt()).isEqualTo(OffsetDateTime.parse("2025-02-01T00:00:00Z"));
        verify(teamMembershipRepository, never()).insertIfAbsent(any(), any(), anyString(), any());
    }

    @Test
    void acceptAfterDeclineIsConflict() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.EDITOR);
        invitation.decline(BOB_ID, OffsetDateTime.parse("2025-02-01T00:00:00Z"));
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(bob));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> invitationService.acceptInvitation(INVITATION_ID, BOB_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("invitation.already_resolved");
                });
        assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.DECLINED);
    }

    @Test
    void declineAfterAcceptIsConflict() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.EDITOR);
        invitation.accept(BOB_ID, OffsetDateTime.parse("2025-02-01T00:00:00Z"));
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(bob));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> invitationService.declineInvitation(INVITATION_ID, BOB_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "invitation.already_resolved");
    }

    @Test
    void invitationForAnotherAddressLooksMissing() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.EDITOR);
        AppUser mallory = new AppUser(MALLORY_ID, "mallory@example.com", true, "Mallory");
        when(appUserRepository.findById(MALLORY_ID)).thenReturn(Optional.of(mallory));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> invitationService.acceptInvitation(INVITATION_ID, MALLORY_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("invitation.not_found");
                });
        assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
    }

    @Test
    void unverifiedEmailCannotAccept() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.EDITOR);
        AppUser unverifiedBob = new AppUser(BOB_ID, "bob@example.com", false, "Bob");
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(unverifiedBob));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> invitationService.acceptInvitation(INVITATION_ID, BOB_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("invitation.email_unverified");
                });
    }

    @Test
    void acceptForVanishedTeamIsNoLongerValid() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.VIEWER);
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(bob));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));
        when(teamMembershipRepository.insertIfAbsent(eq(TEAM_ID), eq(BOB_ID), eq("VIEWER"), any(OffsetDateTime.class)))
                .thenThrow(new DataIntegrityViolationException("fk_team_member_team"));

        assertThatThrownBy(() -> invitationService.acceptInvitation(INVITATION_ID, BOB_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.GONE);
                    assertThat(ex.getCode()).isEqualTo("invitation.no_longer_valid");
                });
        assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
    }

    @Test
    void respondingAfterTeamDeletionIsNoLongerValid() {
        TeamInvitation invitation = pendingInvitationFor("bob@example.com", TeamRole.EDITOR);
        ReflectionTestUtils.setField(invitation, "team", null);
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(bob));
        when(invitationRepository.findByIdForUpdate(INVITATION_ID)).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> invitationService.acceptInvitation(INVITATION_ID, BOB_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.GONE);
                    assertThat(ex.getCode()).isEqualTo("invitation.no_longer_valid");
                });
        assertThatThrownBy(() -> invitationService.declineInvitation(INVITATION_ID, BOB_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "invitation.no_longer_valid");
        assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
        verify(teamMembershipRepository, never()).insertIfAbsent(any(), any(), anyString(), any());
    }

    @Test
    void pendingListIsEmptyUntilEmailVerified() {
        AppUser unverifiedBob = new AppUser(BOB_ID, "bob@example.com", false, "Bob");
        when(appUserRepository.findById(BOB_ID)).thenReturn(Optional.of(unverifiedBob));

        List<InvitationResponse> pending = invitationService.listMyPendingInvitations(BOB_ID);

        assertThat(pending).isEmpty();
        verify(invitationRepository, never()).findPendingByEmail(anyString());
    }

    private void givenAdminAlice() {
        when(teamMembershipRepository.findRole(TEAM_ID, ALICE_ID)).thenReturn(Optional.of(TeamRole.ADMIN));
    }

    private TeamInvitation pendingInvitationFor(String email, TeamRole role) {
        TeamInvitation invitation = new TeamInvitation(team, email, ALICE_ID, role, OffsetDateTime.parse("2025-01-15T00:00:00Z"));
        ReflectionTestUtils.setField(invitation, "id", INVITATION_ID);
        return invitation;
    }
}
