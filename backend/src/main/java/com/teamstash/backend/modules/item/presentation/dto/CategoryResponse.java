package com.teamstash.backend.modules.item.presentation.dto;

import java.util.UUID;

import com.teamstash.backend.modules.item.domain.Category;

public record CategoryResponse(UUID categoryId, String name) {

    public static CategoryResponse from(Category category) {
        return new CategoryResponse(category.getId(), category.getName());
    }
}
