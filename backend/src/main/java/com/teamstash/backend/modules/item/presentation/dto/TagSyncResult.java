package com.teamstash.backend.modules.item.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.teamstash.backend.modules.tag.application.TagReconcileResult;

/**
 * Outcome of the tag step that follows an item write. {@code FAILED} means the item itself was
 * saved and only the tags need to be retried.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TagSyncResult(TagSyncStatus status, String message, List<String> createdTags) {

    public static TagSyncResult synced(TagReconcileResult result) {
        return new TagSyncResult(TagSyncStatus.SYNCED, null, result.createdNames());
    }

    public static TagSyncResult skipped() {
        return new TagSyncResult(TagSyncStatus.SKIPPED, null, null);
    }

    public static TagSyncResult failed(String message) {
        return new TagSyncResult(TagSyncStatus.FAILED, message, null);
    }
}
