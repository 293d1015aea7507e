package com.teamstash.backend.modules.provider.domain;

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
 * Team-scoped record of where items come from (shop, supplier, person).
 */
@Entity
@Table(name = "provider")
public class Provider extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", nullable = false, updatable = false)
    private Team team;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "creator_id", columnDefinition = "uuid")
    private UUID creatorId;

    protected Provider() {
    }

    public Provider(Team team, String name, String description, UUID creatorId) {
        this.team = team;
        this.name = name;
        this.description = description;
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

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public UUID getCreatorId() {
        return creatorId;
    }
}
