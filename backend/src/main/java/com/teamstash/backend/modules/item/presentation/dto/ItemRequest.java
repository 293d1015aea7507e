package com.teamstash.backend.modules.item.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.teamstash.backend.modules.item.application.ItemCommand;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Item form. {@code tags} is comma-separated; omitting it on update leaves the tags untouched,
 * an empty string clears them.
 */
public record ItemRequest(
        @NotBlank @Size(max = 200) String name,
        @Size(max = 2000) String description,
        UUID categoryId,
        @NotNull LocalDate expirationDate,
        @Size(max = 100) String providerName,
        @Size(max = 1000) String tags
) {

    public ItemCommand toCommand() {
        return new ItemCommand(name, description, categoryId, expirationDate, providerName);
    }
}
