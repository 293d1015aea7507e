package com.teamstash.backend.modules.team.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

/**
 * Membership of one principal in one team. The (team, member) pair never changes; only the role does.
 */
@Entity
@Table(name = "team_member")
public class TeamMembership {

    @EmbeddedId
    private TeamMembershipId id;

    @MapsId("teamId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", nullable = false)
    private Team team;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private TeamRole role;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private OffsetDateTime joinedAt;

    protected TeamMembership() {
    }

    public TeamMembership(Team team, UUID memberId, TeamRole role, OffsetDateTime joinedAt) {
        this.id = new TeamMembershipId(team.getId(), memberId);
        this.team = team;
        this.role = role;
        this.joinedAt = joinedAt;
    }

    public TeamMembershipId getId() {
        return id;
    }

    public Team getTeam() {
        return team;
    }

    public UUID getMemberId() {
        return id.getMemberId();
    }

    public TeamRole getRole() {
        return role;
    }

    public void changeRole(TeamRole role) {
        this.role = role;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }
}
