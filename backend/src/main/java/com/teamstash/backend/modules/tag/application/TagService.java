package com.teamstash.backend.modules.tag.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.tag.domain.Tag;
import com.teamstash.backend.modules.tag.domain.TagNames;
import com.teamstash.backend.modules.tag.infrastructure.persistence.ItemTagLinkRepository;
import com.teamstash.backend.modules.tag.infrastructure.persistence.ItemTagLinkRepository.TagUsage;
import com.teamstash.backend.modules.tag.infrastructure.persistence.TagRepository;
import com.teamstash.backend.modules.tag.presentation.dto.TagResponse;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamCapability;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TagService {

    private final TagRepository tagRepository;
    private final ItemTagLinkRepository itemTagLinkRepository;
    private final TeamRoleAuthorizer authorizer;

    public TagService(TagRepository tagRepository, ItemTagLinkRepository itemTagLinkRepository, TeamRoleAuthorizer authorizer) {
        this.tagRepository = tagRepository;
        this.itemTagLinkRepository = itemTagLinkRepository;
        this.authorizer = authorizer;
    }

    @Transactional(readOnly = true)
    public List<TagResponse> listTags(ActiveTeam activeTeam) {
        authorizer.require(activeTeam, TeamCapability.READ_DATA);
        Map<UUID, Long> usage = itemTagLinkRepository.countUsageByTeamId(activeTeam.teamId()).stream()
                .collect(Collectors.toMap(TagUsage::getTagId, TagUsage::getUsageCount));
        return tagRepository.findAllByTeamId(activeTeam.teamId()).stream()
                .map(tag -> TagResponse.from(tag, usage.getOrDefault(tag.getId(), 0L)))
                .toList();
    }

    public TagResponse renameTag(ActiveTeam activeTeam, UUID tagId, String rawName) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        Tag tag = findTag(activeTeam, tagId);
        String name = TagNames.normalize(rawName);
        if (name.isEmpty() || name.length() > TagNames.MAX_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "tag.invalid_name",
                    "Tag names must be between 1 and " + TagNames.MAX_LENGTH + " characters.")
                    .withRejectedInput(Map.of("name", rawName == null ? "" : rawName));
        }
        if (tagRepository.existsOtherWithName(activeTeam.teamId(), name, tagId)) {
            throw nameConflict(name);
        }
        tag.rename(name);
        try {
            tagRepository.saveAndFlush(tag);
        } catch (DataIntegrityViolationException ex) {
            throw nameConflict(name);
        }
        return TagResponse.from(tag, itemTagLinkRepository.countByIdTagId(tagId));
    }

    /**
     * Deletes the tag and, through the database cascade, every link to it.
     */
    public void deleteTag(ActiveTeam activeTeam, UUID tagId) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        tagRepository.delete(findTag(activeTeam, tagId));
    }

    private Tag findTag(ActiveTeam activeTeam, UUID tagId) {
        return tagRepository.findByIdAndTeamId(tagId, activeTeam.teamId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "tag.not_found", "Tag not found."));
    }

    private static ProblemException nameConflict(String name) {
        return new ProblemException(HttpStatus.CONFLICT, "tag.name_conflict",
                "A tag named \"" + name + "\" already exists in this team.")
                .withRejectedInput(Map.of("name", name));
    }
}
