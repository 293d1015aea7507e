package com.teamstash.backend.modules.provider.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ProviderRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 500) String description
) {
}
