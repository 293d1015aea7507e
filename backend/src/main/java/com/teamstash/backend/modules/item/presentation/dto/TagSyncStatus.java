package com.teamstash.backend.modules.item.presentation.dto;

public enum TagSyncStatus {
    SYNCED,
    SKIPPED,
    FAILED
}
