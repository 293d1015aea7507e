package com.teamstash.backend.modules.invitation.domain;

public enum InvitationStatus {
    PENDING,
    ACCEPTED,
    DECLINED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
