package com.teamstash.backend.modules.team.domain;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class TeamMembershipId implements Serializable {

    @Column(name = "team_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID teamId;

    @Column(name = "member_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID memberId;

    protected TeamMembershipId() {
    }

    public TeamMembershipId(UUID teamId, UUID memberId) {
        this.teamId = teamId;
        this.memberId = memberId;
    }

    public UUID getTeamId() {
        return teamId;
    }

    public UUID getMemberId() {
        return memberId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TeamMembershipId that)) return false;
        return Objects.equals(teamId, that.teamId) && Objects.equals(memberId, that.memberId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(teamId, memberId);
    }
}
