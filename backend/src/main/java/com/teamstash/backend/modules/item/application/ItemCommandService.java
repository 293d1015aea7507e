package com.teamstash.backend.modules.item.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.modules.item.presentation.dto.ItemMutationResponse;
import com.teamstash.backend.modules.item.presentation.dto.ItemResponse;
import com.teamstash.backend.modules.item.presentation.dto.TagSyncResult;
import com.teamstash.backend.modules.tag.application.TagReconcileResult;
import com.teamstash.backend.modules.tag.application.TagReconciler;
import com.teamstash.backend.modules.tag.domain.TagNames;
import com.teamstash.backend.modules.team.application.TeamRoleAuthorizer;
import com.teamstash.backend.modules.team.domain.ActiveTeam;
import com.teamstash.backend.modules.team.domain.TeamCapability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Item writes followed by tag reconciliation.
 *
 * <p>The two steps run in separate transactions on purpose: once the item write has committed it is
 * not undone when the tag step fails. The caller then gets the saved item together with a
 * {@code FAILED} tag status and can retry through {@link #replaceTags}. Tag input is validated
 * before anything is written.</p>
 */
@Service
public class ItemCommandService {

    private static final Logger log = LoggerFactory.getLogger(ItemCommandService.class);

    static final String TAG_SYNC_FAILED_MESSAGE =
            "Item saved, but tags could not be updated: retry with PUT /items/{itemId}/tags.";

    private final ItemService itemService;
    private final TagReconciler tagReconciler;
    private final TeamRoleAuthorizer authorizer;

    public ItemCommandService(ItemService itemService, TagReconciler tagReconciler, TeamRoleAuthorizer authorizer) {
        this.itemService = itemService;
        this.tagReconciler = tagReconciler;
        this.authorizer = authorizer;
    }

    public ItemMutationResponse createItem(ActiveTeam activeTeam, UUID principalId, ItemCommand command, String tagsCsv) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        List<String> tags = parseTags(tagsCsv);

        UUID itemId = itemService.createItem(activeTeam, principalId, command);
        TagSyncResult tagSync = tags.isEmpty()
                ? TagSyncResult.skipped()
                : syncTags("create", activeTeam, principalId, itemId, tags);
        return new ItemMutationResponse(itemService.getItem(activeTeam, itemId), tagSync);
    }

    /**
     * @param tagsCsv the complete desired tag list; {@code null} leaves the current tags as they are
     */
    public ItemMutationResponse updateItem(
            ActiveTeam activeTeam,
            UUID principalId,
            UUID itemId,
            ItemCommand command,
            String tagsCsv
    ) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        List<String> tags = tagsCsv == null ? null : parseTags(tagsCsv);

        itemService.updateItem(activeTeam, principalId, itemId, command);
        TagSyncResult tagSync = tags == null
                ? TagSyncResult.skipped()
                : syncTags("update", activeTeam, principalId, itemId, tags);
        return new ItemMutationResponse(itemService.getItem(activeTeam, itemId), tagSync);
    }

    /**
     * Runs only the tag step. Failures surface as errors since nothing else was written.
     */
    public ItemResponse replaceTags(ActiveTeam activeTeam, UUID principalId, UUID itemId, String tagsCsv) {
        authorizer.require(activeTeam, TeamCapability.MUTATE_DATA);
        List<String> tags = parseTags(tagsCsv);
        itemService.findItem(activeTeam.teamId(), itemId);
        tagReconciler.reconcile(itemId, activeTeam.teamId(), principalId, tags);
        return itemService.getItem(activeTeam, itemId);
    }

    private TagSyncResult syncTags(String operation, ActiveTeam activeTeam, UUID principalId, UUID itemId, List<String> tags) {
        try {
            TagReconcileResult result = tagReconciler.reconcile(itemId, activeTeam.teamId(), principalId, tags);
            return TagSyncResult.synced(result);
        } catch (RuntimeException ex) {
            log.warn("Tag sync failed after item {} itemId={} teamId={} principalId={}",
                    operation, itemId, activeTeam.teamId(), principalId, ex);
            return TagSyncResult.failed(TAG_SYNC_FAILED_MESSAGE);
        }
    }

    private static List<String> parseTags(String tagsCsv) {
        List<String> tags = TagNames.splitCsv(tagsCsv);
        List<String> tooLong = TagNames.tooLong(tags);
        if (!tooLong.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "item.invalid_tags",
                    "Tags must be at most " + TagNames.MAX_LENGTH + " characters: " + String.join(", ", tooLong))
                    .withRejectedInput(Map.of("tags", tagsCsv));
        }
        return tags;
    }
}
