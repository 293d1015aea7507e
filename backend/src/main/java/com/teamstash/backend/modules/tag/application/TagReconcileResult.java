package com.teamstash.backend.modules.tag.application;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * What a reconciliation changed. An empty result means the item already carried exactly the desired tags.
 */
public record TagReconcileResult(
        Set<String> desiredNames,
        List<UUID> unlinkedTagIds,
        List<UUID> attachedTagIds,
        List<String> createdNames
) {

    public boolean isNoop() {
        return unlinkedTagIds.isEmpty() && attachedTagIds.isEmpty();
    }
}
