package com.teamstash.backend.modules.tag.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.teamstash.backend.modules.tag.domain.Tag;

public record TagResponse(UUID tagId, String name, long usageCount, OffsetDateTime createdAt) {

    public static TagResponse from(Tag tag, long usageCount) {
        return new TagResponse(tag.getId(), tag.getName(), usageCount, tag.getCreatedAt());
    }
}
