package com.teamstash.backend.modules.team;

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
import com.teamstash.backend.modules.account.infrastructure.persistence.AppUserRepository;
import com.teamstash.backend.modules.team.application.TeamMembershipService;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.Team;
import com.teamstash.backend.modules.team.domain.TeamMembership;
import com.teamstash.backend.modules.team.domain.TeamMembershipId;
import com.teamstash.backend.modules.team.domain.TeamRole;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamMembershipRepository;
import com.teamstash.backend.modules.team.infrastructure.persistence.TeamRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TeamMembershipServiceTest {

    private static final UUID TEAM_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    private static final UUID OWNER_ID = UUID.fromString("00000000-0000-0000-0000-00000000b001");
    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-00000000b002");
    private static final UUID VIEWER_ID = UUID.fromString("00000000-0000-0000-0000-00000000b003");

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private TeamMembershipRepository teamMembershipRepository;

    @Mock
    private AppUserRepository appUserRepository;

    private TeamMembershipService service;
    private Team team;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new TeamMembershipService(
                teamRepository,
                teamMembershipRepository,
                appUserRepository,
                new TeamRoleAuthorizer(teamMembershipRepository),
                clock
        );
        team = new Team("Groceries", OWNER_ID);
        ReflectionTestUtils.setField(team, "id", TEAM_ID);
    }

    @Test
    void ownerCannotBeDemoted() {
        givenRole(ADMIN_ID, TeamRole.ADMIN);
        givenLockedTeam();
        givenMembership(OWNER_ID, TeamRole.ADMIN);

        assertThatThrownBy(() -> service.changeRole(TEAM_ID, ADMIN_ID, OWNER_ID, TeamRole.EDITOR))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("team.owner_must_transfer");
                });
    }

    @Test
    void lastAdminCannotStepDown() {
        givenRole(ADMIN_ID, TeamRole.ADMIN);
        givenLockedTeam();
        TeamMembership self = givenMembership(ADMIN_ID, TeamRole.ADMIN);
        when(teamMembershipRepository.countByTeamIdAndRole(TEAM_ID, TeamRole.ADMIN)).thenReturn(1L);

        assertThatThrownBy(() -> service.changeRole(TEAM_ID, ADMIN_ID, ADMIN_ID, TeamRole.VIEWER))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "team.last_admin");
        assertThat(self.getRole()).isEqualTo(TeamRole.ADMIN);
    }

    @Test
    void adminCanBeDemotedWhileAnotherAdminRemains() {
        givenRole(OWNER_ID, TeamRole.ADMIN);
        givenLockedTeam();
        TeamMembership target = givenMembership(ADMIN_ID, TeamRole.ADMIN);
        when(teamMembershipRepository.countByTeamIdAndRole(TEAM_ID, TeamRole.ADMIN)).thenReturn(2L);
        when(appUserRepository.findById(ADMIN_ID)).thenReturn(Optional.empty());

        service.changeRole(TEAM_ID, OWNER_ID, ADMIN_ID, TeamRole.EDITOR);

        assertThat(target.getRole()).isEqualTo(TeamRole.EDITOR);
    }

    @Test
    void viewerCanLeave() {
        givenRole(VIEWER_ID, TeamRole.VIEWER);
        givenLockedTeam();
        TeamMembership membership = givenMembership(VIEWER_ID, TeamRole.VIEWER);

        service.removeMember(TEAM_ID, VIEWER_ID, VIEWER_ID);

        verify(teamMembershipRepository).delete(membership);
    }

    @Test
    void viewerCannotRemoveOthers() {
        givenRole(VIEWER_ID, TeamRole.VIEWER);

        assertThatThrownBy(() -> service.removeMember(TEAM_ID, VIEWER_ID, ADMIN_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "team.forbidden");
        verify(teamMembershipRepository, never()).delete(any(TeamMembership.class));
    }

    @Test
    void ownerCannotLeaveWithoutTransfer() {
        givenRole(OWNER_ID, TeamRole.ADMIN);
        givenLockedTeam();
        givenMembership(OWNER_ID, TeamRole.ADMIN);

        assertThatThrownBy(() -> service.removeMember(TEAM_ID, OWNER_ID, OWNER_ID))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "team.owner_must_transfer");
    }

    @Test
    void addingUnknownEmailPointsToInvitations() {
        givenRole(OWNER_ID, TeamRole.ADMIN);
        when(teamRepository.findById(TEAM_ID)).thenReturn(Optional.of(team));
        when(appUserRepository.findVerifiedIdsByEmail("carol@example.com")).thenReturn(List.of());

        assertThatThrownBy(() -> service.addMember(TEAM_ID, OWNER_ID, " Carol@Example.com ", TeamRole.EDITOR))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("team.account_not_found");
                });
    }

    @Test
    void addingExistingMemberIsConflict() {
        givenRole(OWNER_ID, TeamRole.ADMIN);
        when(teamRepository.findById(TEAM_ID)).thenReturn(Optional.of(team));
        when(appUserRepository.findVerifiedIdsByEmail("viewer@example.com")).thenReturn(List.of(VIEWER_ID));
        when(teamMembershipRepository.insertIfAbsent(eq(TEAM_ID), eq(VIEWER_ID), anyString(), any(OffsetDateTime.class)))
                .thenReturn(0);

        assertThatThrownBy(() -> service.addMember(TEAM_ID, OWNER_ID, "viewer@example.com", TeamRole.EDITOR))
                .isInstanceOf(ProblemException.class)
                .hasFieldOrPropertyWithValue("code", "team.already_member");
    }

    @Test
    void addingAddressSharedByVerifiedAccountsIsRejected() {
        givenRole(OWNER_ID, TeamRole.ADMIN);
        when(teamRepository.findById(TEAM_ID)).thenReturn(Optional.of(team));
        when(appUserRepository.findVerifiedIdsByEmail("shared@example.com")).thenReturn(List.of(ADMIN_ID, VIEWER_ID));

        assertThatThrownBy(() -> service.addMember(TEAM_ID, OWNER_ID, "shared@example.com", TeamRole.VIEWER))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("team.account_ambiguous");
                    assertThat(ex.getRejectedInput()).containsEntry("email", "shared@example.com");
                });
        verify(teamMembershipRepository, never()).insertIfAbsent(any(), any(), anyString(), any());
    }

    private void givenRole(UUID principalId, TeamRole role) {
        when(teamMembershipRepository.findRole(TEAM_ID, principalId)).thenReturn(Optional.of(role));
    }

    private void givenLockedTeam() {
        when(teamRepository.findByIdForUpdate(TEAM_ID)).thenReturn(Optional.of(team));
    }

    private TeamMembership givenMembership(UUID memberId, TeamRole role) {
        TeamMembership membership = new TeamMembership(team, memberId, role, OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        when(teamMembershipRepository.findById(new TeamMembershipId(TEAM_ID, memberId))).thenReturn(Optional.of(membership));
        return membership;
    }
}
