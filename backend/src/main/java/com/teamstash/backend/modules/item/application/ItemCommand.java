package com.teamstash.backend.modules.item.application;

import java.time.LocalDate;
import java.util.UUID;

public record ItemCommand(
        String name,
        String description,
        UUID categoryId,
        LocalDate expirationDate,
        String providerName
) {
}
