package com.teamstash.backend.modules.team.domain;

import java.util.Optional;

/**
 * Role of a member within one team.
 */
public enum TeamRole {
    ADMIN,
    EDITOR,
    VIEWER;

    public boolean canManageTeam() {
        return this == ADMIN;
    }

    public boolean canMutateData() {
        return this == ADMIN || this == EDITOR;
    }

    public boolean canReadData() {
        return true;
    }

    public boolean permits(TeamCapability capability) {
        return switch (capability) {
            case READ_DATA -> canReadData();
            case MUTATE_DATA -> canMutateData();
            case MANAGE_TEAM -> canManageTeam();
        };
    }

    /**
     * Non-members hold no role and are granted nothing.
     */
    public static boolean permits(Optional<TeamRole> role, TeamCapability capability) {
        return role.map(r -> r.permits(capability)).orElse(false);
    }
}
