package com.teamstash.backend.modules.team.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * The team a single request operates against, together with the caller's role in it.
 * Computed once per request and passed explicitly to every downstream call.
 */
public record ActiveTeam(UUID teamId, String teamName, TeamRole role) {

    public ActiveTeam {
        Objects.requireNonNull(teamId, "teamId");
        Objects.requireNonNull(role, "role");
    }
}
