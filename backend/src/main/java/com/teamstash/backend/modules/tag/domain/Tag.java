package com.teamstash.backend.modules.tag.domain;

import java.util.UUID;

import com.teamstash.backend.global.jpa.AbstractTimestampedEntity;
import com.teamstash.backend.modules.team.domain.Team;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Team-level label. Names are unique per team ignoring case; tags outlive the items they are attached to.
 */
@Entity
@Table(name = "tag")
public class Tag extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", nullable = false, updatable = false)
    private Team team;

    @Column(name = "name", nullable = false, length = TagNames.MAX_LENGTH)
    private String name;

    @Column(name = "creator_id", columnDefinition = "uuid")
    private UUID creatorId;

    protected Tag() {
    }

    public Tag(Team team, String name, UUID creatorId) {
        this.team = team;
        this.name = name;
        this.creatorId = creatorId;
    }

    public UUID getId() {
        return id;
    }

    public Team getTeam() {
        return team;
    }

    public String getName() {
        return name;
    }

    public void rename(String name) {
        this.name = name;
    }

    public UUID getCreatorId() {
        return creatorId;
    }
}
