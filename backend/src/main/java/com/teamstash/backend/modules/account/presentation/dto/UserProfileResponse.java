package com.teamstash.backend.modules.account.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String email,
        boolean emailVerified,
        String displayName,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
