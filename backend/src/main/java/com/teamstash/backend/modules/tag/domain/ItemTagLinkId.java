package com.teamstash.backend.modules.tag.domain;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class ItemTagLinkId implements Serializable {

    @Column(name = "item_id", nullable = false, columnDefinition = "uuid")
    private UUID itemId;

    @Column(name = "tag_id", nullable = false, columnDefinition = "uuid")
    private UUID tagId;

    protected ItemTagLinkId() {
    }

    public ItemTagLinkId(UUID itemId, UUID tagId) {
        this.itemId = itemId;
        this.tagId = tagId;
    }

    public UUID getItemId() {
        return itemId;
    }

    public UUID getTagId() {
        return tagId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ItemTagLinkId that)) return false;
        return Objects.equals(itemId, that.itemId) && Objects.equals(tagId, that.tagId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemId, tagId);
    }
}
