package com.teamstash.backend.modules.item.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.teamstash.backend.modules.item.domain.ItemNote;

public record ItemNoteResponse(
        UUID noteId,
        UUID authorId,
        String noteText,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ItemNoteResponse from(ItemNote note) {
        return new ItemNoteResponse(note.getId(), note.getAuthorId(), note.getNoteText(),
                note.getCreatedAt(), note.getUpdatedAt());
    }
}
