package com.teamstash.backend.modules.team.domain;

/**
 * Actions a team role may or may not grant. Capabilities are independent predicates, not a ranking.
 */
public enum TeamCapability {
    READ_DATA,
    MUTATE_DATA,
    MANAGE_TEAM
}
