package com.teamstash.backend.modules.tag.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RenameTagRequest(@NotBlank String name) {
}
