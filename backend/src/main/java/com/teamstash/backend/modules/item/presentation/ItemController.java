package com.teamstash.backend.modules.item.presentation;

import java.util.List;
import java.util.UUID;

import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.item.application.ItemCommandService;
import com.teamstash.backend.modules.item.application.ItemService;
import com.teamstash.backend.modules.item.presentation.dto.ItemMutationResponse;
import com.teamstash.backend.modules.item.presentation.dto.ItemRequest;
import com.teamstash.backend.modules.item.presentation.dto.ItemResponse;
import com.teamstash.backend.modules.item.presentation.dto.ItemTagsRequest;
import com.teamstash.backend.modules.team.domain.ActiveTeam;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/items")
@Tag(name = "Items")
public class ItemController {

    private final ItemService itemService;
    private final ItemCommandService itemCommandService;

    public ItemController(ItemService itemService, ItemCommandService itemCommandService) {
        this.itemService = itemService;
        this.itemCommandService = itemCommandService;
    }

    @GetMapping
    public ResponseEntity<List<ItemResponse>> listItems(ActiveTeam activeTeam) {
        return ResponseEntity.ok(itemService.listItems(activeTeam));
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<ItemResponse> getItem(ActiveTeam activeTeam, @PathVariable UUID itemId) {
        return ResponseEntity.ok(itemService.getItem(activeTeam, itemId));
    }

    @Operation(summary = "Create an item", description = "tagSync.status is FAILED when the item was saved but its tags were not")
    @PostMapping
    public ResponseEntity<ItemMutationResponse> createItem(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ItemRequest request
    ) {
        ItemMutationResponse response = itemCommandService.createItem(
                activeTeam, principal.userId(), request.toCommand(), request.tags());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Update an item", description = "tagSync.status is FAILED when the item was saved but its tags were not")
    @PutMapping("/{itemId}")
    public ResponseEntity<ItemMutationResponse> updateItem(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID itemId,
            @Valid @RequestBody ItemRequest request
    ) {
        return ResponseEntity.ok(itemCommandService.updateItem(
                activeTeam, principal.userId(), itemId, request.toCommand(), request.tags()));
    }

    @Operation(summary = "Replace an item's tags")
    @PutMapping("/{itemId}/tags")
    public ResponseEntity<ItemResponse> replaceTags(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID itemId,
            @Valid @RequestBody ItemTagsRequest request
    ) {
        return ResponseEntity.ok(itemCommandService.replaceTags(activeTeam, principal.userId(), itemId, request.tags()));
    }

    @DeleteMapping("/{itemId}")
    public ResponseEntity<Void> deleteItem(
            ActiveTeam activeTeam,
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID itemId
    ) {
        itemService.deleteItem(activeTeam, principal.userId(), itemId);
        return ResponseEntity.noContent().build();
    }
}
