package com.teamstash.backend.modules.tag.domain;

import java.util.UUID;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

/**
 * Association between an item and a tag. Rows are removed by the database when either side is deleted.
 */
@Entity
@Table(name = "item_tag_link")
public class ItemTagLink {

    @EmbeddedId
    private ItemTagLinkId id;

    @MapsId("tagId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tag_id", nullable = false)
    private Tag tag;

    protected ItemTagLink() {
    }

    public ItemTagLink(UUID itemId, Tag tag) {
        this.id = new ItemTagLinkId(itemId, tag.getId());
        this.tag = tag;
    }

    public ItemTagLinkId getId() {
        return id;
    }

    public UUID getItemId() {
        return id.getItemId();
    }

    public Tag getTag() {
        return tag;
    }
}
