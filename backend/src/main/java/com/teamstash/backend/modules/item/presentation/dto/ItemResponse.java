package com.teamstash.backend.modules.item.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code notes} is only populated on the detail view.
 */
public record ItemResponse(
        UUID itemId,
        String name,
        String description,
        UUID categoryId,
        String categoryName,
        LocalDate expirationDate,
        UUID providerId,
        String providerName,
        List<String> tags,
        UUID creatorId,
        UUID modifierId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        @JsonInclude(JsonInclude.Include.NON_NULL) List<ItemNoteResponse> notes
) {
}
