package com.teamstash.backend.modules.item.domain;

import java.util.UUID;

import com.teamstash.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "item_note")
public class ItemNote extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "item_id", nullable = false, updatable = false)
    private Item item;

    @Column(name = "author_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID authorId;

    @Column(name = "note_text", nullable = false, length = 2000)
    private String noteText;

    protected ItemNote() {
    }

    public ItemNote(Item item, UUID authorId, String noteText) {
        this.item = item;
        this.authorId = authorId;
        this.noteText = noteText;
    }

    public UUID getId() {
        return id;
    }

    public Item getItem() {
        return item;
    }

    public UUID getAuthorId() {
        return authorId;
    }

    public String getNoteText() {
        return noteText;
    }

    public void setNoteText(String noteText) {
        this.noteText = noteText;
    }
}
