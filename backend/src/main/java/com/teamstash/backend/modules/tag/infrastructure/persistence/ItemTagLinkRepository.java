package com.teamstash.backend.modules.tag.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.teamstash.backend.modules.tag.domain.ItemTagLink;
import com.teamstash.backend.modules.tag.domain.ItemTagLinkId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ItemTagLinkRepository extends JpaRepository<ItemTagLink, ItemTagLinkId> {

    @Query("select l from ItemTagLink l join fetch l.tag t where l.id.itemId = :itemId")
    List<ItemTagLink> findByItemIdWithTag(@Param("itemId") UUID itemId);

    @Query("""
            select l from ItemTagLink l
              join fetch l.tag t
             where l.id.itemId in :itemIds
             order by lower(t.name) asc
            """)
    List<ItemTagLink> findByItemIdInWithTag(@Param("itemIds") Collection<UUID> itemIds);

    long countByIdTagId(UUID tagId);

    @Query("""
            select l.id.tagId as tagId, count(l) as usageCount
              from ItemTagLink l
             where l.tag.team.id = :teamId
             group by l.id.tagId
            """)
    List<TagUsage> countUsageByTeamId(@Param("teamId") UUID teamId);

    @Modifying
    @Query("delete from ItemTagLink l where l.id.itemId = :itemId and l.id.tagId in :tagIds")
    int deleteLinks(@Param("itemId") UUID itemId, @Param("tagIds") Collection<UUID> tagIds);

    @Modifying
    @Query(value = """
            insert into item_tag_link (item_id, tag_id)
            values (:itemId, :tagId)
            on conflict do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("itemId") UUID itemId, @Param("tagId") UUID tagId);

    interface TagUsage {
        UUID getTagId();

        long getUsageCount();
    }
}
