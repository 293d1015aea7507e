package com.teamstash.backend.modules.invitation.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.teamstash.backend.modules.team.domain.Team;
import com.teamstash.backend.modules.team.domain.TeamRole;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Invitation addressed to an email. It is bound to a principal only when that principal
 * accepts or declines it with a matching verified email.
 */
@Entity
@Table(name = "team_invitation")
public class TeamInvitation {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", updatable = false)
    private Team team;

    @Column(name = "email_invited", nullable = false, updatable = false, length = 320)
    private String emailInvited;

    @Column(name = "invited_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID invitedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, updatable = false, length = 16)
    private TeamRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private InvitationStatus status = InvitationStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    @Column(name = "resolved_by", columnDefinition = "uuid")
    private UUID resolvedBy;

    protected TeamInvitation() {
    }

    public TeamInvitation(Team team, String emailInvited, UUID invitedBy, TeamRole role, OffsetDateTime createdAt) {
        this.team = team;
        this.emailInvited = emailInvited;
        this.invitedBy = invitedBy;
        this.role = role;
        this.createdAt = createdAt;
    }

    public void accept(UUID principalId, OffsetDateTime now) {
        resolve(InvitationStatus.ACCEPTED, principalId, now);
    }

    public void decline(UUID principalId, OffsetDateTime now) {
        resolve(InvitationStatus.DECLINED, principalId, now);
    }

    private void resolve(InvitationStatus target, UUID principalId, OffsetDateTime now) {
        if (status != InvitationStatus.PENDING) {
            throw new IllegalStateException("Invitation " + id + " is already " + status);
        }
        this.status = target;
        this.resolvedBy = principalId;
        this.resolvedAt = now;
    }

    public UUID getId() {
        return id;
    }

    /**
     * @return the team, or {@code null} once the team has been deleted
     */
    public Team getTeam() {
        return team;
    }

    public boolean isTeamGone() {
        return team == null;
    }

    public String getEmailInvited() {
        return emailInvited;
    }

    public UUID getInvitedBy() {
        return invitedBy;
    }

    public TeamRole getRole() {
        return role;
    }

    public InvitationStatus getStatus() {
        return status;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getResolvedAt() {
        return resolvedAt;
    }

    public UUID getResolvedBy() {
        return resolvedBy;
    }
}
