package com.teamstash.backend.modules.tag.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.teamstash.backend.modules.tag.domain.ItemTagLink;
import com.teamstash.backend.modules.tag.domain.Tag;
import com.teamstash.backend.modules.tag.domain.TagNames;
import com.teamstash.backend.modules.tag.infrastructure.persistence.ItemTagLinkRepository;
import com.teamstash.backend.modules.tag.infrastructure.persistence.TagRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Brings an item's tag links to a desired set of names with the fewest writes.
 *
 * <p>Names are compared trimmed and lower-cased. Links to tags no longer wanted are removed but the
 * tags themselves stay, since other items may use them. Wanted names are matched against the team's
 * existing tags first and only created when missing. Every insert tolerates a concurrent duplicate,
 * so overlapping reconciliations never produce duplicate rows.</p>
 *
 * <p>Callers are responsible for checking that the item belongs to {@code teamId} and that the
 * actor may mutate team data.</p>
 */
@Service
@Transactional
public class TagReconciler {

    private static final Logger log = LoggerFactory.getLogger(TagReconciler.class);

    private final TagRepository tagRepository;
    private final ItemTagLinkRepository itemTagLinkRepository;
    private final Clock clock;

    public TagReconciler(TagRepository tagRepository, ItemTagLinkRepository itemTagLinkRepository, Clock clock) {
        this.tagRepository = tagRepository;
        this.itemTagLinkRepository = itemTagLinkRepository;
        this.clock = clock;
    }

    /**
     * @param desiredNames the complete desired tag set for the item, not a delta
     */
    public TagReconcileResult reconcile(UUID itemId, UUID teamId, UUID actorId, Collection<String> desiredNames) {
        Set<String> desired = TagNames.normalize(desiredNames);

        Set<String> alreadyLinked = new HashSet<>();
        List<UUID> toUnlink = new ArrayList<>();
        for (ItemTagLink link : itemTagLinkRepository.findByItemIdWithTag(itemId)) {
            String current = TagNames.normalize(link.getTag().getName());
            if (desired.contains(current)) {
                alreadyLinked.add(current);
            } else {
                toUnlink.add(link.getId().getTagId());
            }
        }
        if (!toUnlink.isEmpty()) {
            itemTagLinkRepository.deleteLinks(itemId, toUnlink);
        }

        Set<String> toAttach = new LinkedHashSet<>(desired);
        toAttach.removeAll(alreadyLinked);
        if (toAttach.isEmpty()) {
            return new TagReconcileResult(desired, toUnlink, List.of(), List.of());
        }

        Map<String, UUID> resolved = findTeamTags(teamId, toAttach);
        List<String> created = new ArrayList<>();
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (String name : toAttach) {
            if (!resolved.containsKey(name)
                    && tagRepository.insertIfAbsent(UUID.randomUUID(), teamId, name, actorId, now) > 0) {
                created.add(name);
            }
        }
        if (resolved.size() < toAttach.size()) {
            resolved = findTeamTags(teamId, toAttach);
        }

        List<UUID> attached = new ArrayList<>();
        for (String name : toAttach) {
            UUID tagId = resolved.get(name);
            if (tagId == null) {
                throw new IllegalStateException("Tag '" + name + "' could not be resolved for team " + teamId);
            }
            itemTagLinkRepository.insertIfAbsent(itemId, tagId);
            attached.add(tagId);
        }

        log.debug("Tags reconciled itemId={} teamId={} unlinked={} attached={} created={}",
                itemId, teamId, toUnlink.size(), attached.size(), created.size());
        return new TagReconcileResult(desired, toUnlink, attached, created);
    }

    private Map<String, UUID> findTeamTags(UUID teamId, Set<String> normalizedNames) {
        Map<String, UUID> byName = new HashMap<>();
        for (Tag tag : tagRepository.findByTeamIdAndNormalizedNameIn(teamId, normalizedNames)) {
            byName.put(TagNames.normalize(tag.getName()), tag.getId());
        }
        return byName;
    }
}
