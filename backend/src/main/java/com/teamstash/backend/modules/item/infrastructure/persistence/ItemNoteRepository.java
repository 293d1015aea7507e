package com.teamstash.backend.modules.item.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.modules.item.domain.ItemNote;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ItemNoteRepository extends JpaRepository<ItemNote, UUID> {

    @Query("select n from ItemNote n where n.item.id = :itemId order by n.createdAt desc")
    List<ItemNote> findByItemIdNewestFirst(@Param("itemId") UUID itemId);

    @Query("select n from ItemNote n where n.id = :id and n.item.id = :itemId")
    Optional<ItemNote> findByIdAndItemId(@Param("id") UUID id, @Param("itemId") UUID itemId);
}
