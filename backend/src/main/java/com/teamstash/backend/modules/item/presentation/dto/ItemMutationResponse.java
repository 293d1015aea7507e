package com.teamstash.backend.modules.item.presentation.dto;

public record ItemMutationResponse(ItemResponse item, TagSyncResult tagSync) {
}
