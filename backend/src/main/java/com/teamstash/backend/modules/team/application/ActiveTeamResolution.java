package com.teamstash.backend.modules.team.application;

import com.teamstash.backend.modules.team.domain.ActiveTeam;

/**
 * Outcome of active-team resolution. {@code preferenceChanged} tells the request boundary
 * to persist the selected team as the caller's new preference.
 */
public record ActiveTeamResolution(ActiveTeam activeTeam, boolean preferenceChanged) {
}
