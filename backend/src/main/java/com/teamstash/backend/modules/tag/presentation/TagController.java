package com.teamstash.backend.modules.tag.presentation;

import java.util.List;
import java.util.UUID;

import com.teamstash.backend.modules.tag.application.TagService;
import com.teamstash.backend.modules.tag.presentation.dto.RenameTagRequest;
import com.teamstash.backend.modules.tag.presentation.dto.TagResponse;
import com.teamstash.backend.modules.team.domain.ActiveTeam;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tags")
@Tag(name = "Tags")
public class TagController {

    private final TagService tagService;

    public TagController(TagService tagService) {
        this.tagService = tagService;
    }

    @GetMapping
    public ResponseEntity<List<TagResponse>> listTags(ActiveTeam activeTeam) {
        return ResponseEntity.ok(tagService.listTags(activeTeam));
    }

    @PatchMapping("/{tagId}")
    public ResponseEntity<TagResponse> renameTag(
            ActiveTeam activeTeam,
            @PathVariable UUID tagId,
            @Valid @RequestBody RenameTagRequest request
    ) {
        return ResponseEntity.ok(tagService.renameTag(activeTeam, tagId, request.name()));
    }

    @DeleteMapping("/{tagId}")
    public ResponseEntity<Void> deleteTag(ActiveTeam activeTeam, @PathVariable UUID tagId) {
        tagService.deleteTag(activeTeam, tagId);
        return ResponseEntity.noContent().build();
    }
}
