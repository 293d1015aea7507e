package com.teamstash.backend.modules.provider.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.teamstash.backend.modules.provider.domain.Provider;

public record ProviderResponse(
        UUID providerId,
        String name,
        String description,
        UUID creatorId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ProviderResponse from(Provider provider) {
        return new ProviderResponse(
                provider.getId(),
                provider.getName(),
                provider.getDescription(),
                provider.getCreatorId(),
                provider.getCreatedAt(),
                provider.getUpdatedAt()
        );
    }
}
