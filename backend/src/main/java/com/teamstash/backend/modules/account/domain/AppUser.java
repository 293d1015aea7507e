package com.teamstash.backend.modules.account.domain;

import java.util.UUID;

import com.teamstash.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Local mirror of an identity-provider account. The id is the token subject and is never generated here.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "display_name", length = 100)
    private String displayName;

    protected AppUser() {
    }

    public AppUser(UUID id, String email, boolean emailVerified, String displayName) {
        this.id = id;
        this.email = email;
        this.emailVerified = emailVerified;
        this.displayName = displayName;
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public String getDisplayName() {
        return displayName;
    }
}
