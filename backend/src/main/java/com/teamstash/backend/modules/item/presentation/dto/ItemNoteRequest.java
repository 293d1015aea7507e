package com.teamstash.backend.modules.item.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ItemNoteRequest(@NotBlank @Size(max = 2000) String noteText) {
}
