package com.teamstash.backend.modules.item.presentation;

import java.util.UUID;

import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.item.application.ItemNoteService;
import com.teamstash.backend.modules.item.presentation.dto.ItemNoteRequest;
import com.teamstash.backend.modules.item.presentation.dto.ItemNoteResponse;
import com.teamstash.backend.modules.team.domain.ActiveTeam;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/items/{itemId}/notes")
@Tag(name = "Item Notes")
public class ItemNoteController {

    private final ItemNoteService itemNoteService;

    public ItemNoteController(ItemNoteService itemNoteService) {
        this.itemNoteService = itemNoteService;
    }

    @PostMapping
    public ResponseEntity<ItemNoteResponse> addNote(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID itemId,
            @Valid @RequestBody ItemNoteRequest request
    ) {
        ItemNoteResponse created = itemNoteService.addNote(activeTeam, principal.userId(), itemId, request.noteText());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{noteId}")
    public ResponseEntity<ItemNoteResponse> updateNote(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID itemId,
            @PathVariable UUID noteId,
            @Valid @RequestBody ItemNoteRequest request
    ) {
        return ResponseEntity.ok(itemNoteService.updateNote(activeTeam, principal.userId(), itemId, noteId, request.noteText()));
    }

    @DeleteMapping("/{noteId}")
    public ResponseEntity<Void> deleteNote(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID itemId,
            @PathVariable UUID noteId
    ) {
        itemNoteService.deleteNote(activeTeam, principal.userId(), itemId, noteId);
        return ResponseEntity.noContent().build();
    }
}
