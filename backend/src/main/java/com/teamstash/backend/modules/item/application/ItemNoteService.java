package com.teamstash.backend.modules.item.application;

import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.item.domain.Item;
import com.teamstash.backend.modules.item.domain.ItemNote;
import com.teamstash.backend.modules.item.infrastructure.persistence.ItemNoteRepository;
import com.teamstash.backend.modules.item.presentation.dto.ItemNoteResponse;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamCapability;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Notes can be added by anyone who may edit team data; editing or removing a note is limited to
 * its author and team admins.
 */
@Service
@Transactional
public class ItemNoteService {

    private final ItemNoteRepository itemNoteRepository;
    private final ItemService itemService;
    private final TeamRoleAuthorizer authorizer;

    public ItemNoteService(ItemNoteRepository itemNoteRepository, ItemService itemService, TeamRoleAuthorizer authorizer) {
        this.itemNoteRepository = itemNoteRepository;
        this.itemService = itemService;
        this.authorizer = authorizer;
    }

    public ItemNoteResponse addNote(ActiveTeam activeTeam, UUID principalId, UUID itemId, String noteText) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        Item item = itemService.findItem(activeTeam.teamId(), itemId);
        ItemNote note = new ItemNote(item, principalId, requireText(noteText));
        return ItemNoteResponse.from(itemNoteRepository.saveAndFlush(note));
    }

    public ItemNoteResponse updateNote(ActiveTeam activeTeam, UUID principalId, UUID itemId, UUID noteId, String noteText) {
        ItemNote note = loadEditableNote(activeTeam, principalId, itemId, noteId);
        note.setNoteText(requireText(noteText));
        return ItemNoteResponse.from(itemNoteRepository.saveAndFlush(note));
    }

    public void deleteNote(ActiveTeam activeTeam, UUID principalId, UUID itemId, UUID noteId) {
        itemNoteRepository.delete(loadEditableNote(activeTeam, principalId, itemId, noteId));
    }

    private ItemNote loadEditableNote(ActiveTeam activeTeam, UUID principalId, UUID itemId, UUID noteId) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        itemService.findItem(activeTeam.teamId(), itemId);
        ItemNote note = itemNoteRepository.findByIdAndItemId(noteId, itemId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "note.not_found", "Note not found."));
        if (!note.getAuthorId().equals(principalId) && !activeTeam.role().canManageTeam()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "note.forbidden",
                    "Only the author or a team admin can change this note.");
        }
        return note;
    }

    private static String requireText(String noteText) {
        String text = noteText == null ? "" : noteText.trim();
        if (text.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "note.invalid_text", "Note text is required.");
        }
        return text;
    }
}
