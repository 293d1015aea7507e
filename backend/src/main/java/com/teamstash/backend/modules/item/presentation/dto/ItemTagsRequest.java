package com.teamstash.backend.modules.item.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ItemTagsRequest(@NotNull @Size(max = 1000) String tags) {
}
