package com.teamstash.backend.modules.item.domain;

import java.time.LocalDate;
import java.util.UUID;

import com.teamstash.backend.global.jpa.AbstractTimestampedEntity;
import com.teamstash.backend.modules.provider.domain.Provider;
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
 * Tracked item. Belongs to exactly one team; creator and modifier ids are provenance only.
 */
@Entity
@Table(name = "item")
public class Item extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id", nullable = false, updatable = false)
    private Team team;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private Category category;

    @Column(name = "expiration_date", nullable = false)
    private LocalDate expirationDate;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "provider_id")
    private Provider provider;

    @Column(name = "provider_name_manual", length = 100)
    private String providerNameManual;

    @Column(name = "creator_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID creatorId;

    @Column(name = "modifier_id", columnDefinition = "uuid")
    private UUID modifierId;

    protected Item() {
    }

    public Item(Team team, UUID creatorId) {
        this.team = team;
        this.creatorId = creatorId;
        this.modifierId = creatorId;
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

    public Category getCategory() {
        return category;
    }

    public void setCategory(Category category) {
        this.category = category;
    }

    public LocalDate getExpirationDate() {
        return expirationDate;
    }

    public void setExpirationDate(LocalDate expirationDate) {
        this.expirationDate = expirationDate;
    }

    public Provider getProvider() {
        return provider;
    }

    public String getProviderNameManual() {
        return providerNameManual;
    }

    /**
     * Sets the provider link and the free-text name together; at most one of them is non-null.
     */
    public void assignProvider(Provider provider, String providerNameManual) {
        this.provider = provider;
        this.providerNameManual = provider != null ? null : providerNameManual;
    }

    public UUID getCreatorId() {
        return creatorId;
    }

    public UUID getModifierId() {
        return modifierId;
    }

    public void setModifierId(UUID modifierId) {
        this.modifierId = modifierId;
    }
}
