package com.teamstash.backend.modules.tag.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.modules.tag.domain.Tag;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TagRepository extends JpaRepository<Tag, UUID> {

    /**
     * @param normalizedNames lower-cased names
     */
    @Query("select t from Tag t where t.team.id = :teamId and lower(t.name) in :names")
    List<Tag> findByTeamIdAndNormalizedNameIn(
            @Param("teamId") UUID teamId,
            @Param("names") Collection<String> normalizedNames
    );

    @Query("select t from Tag t where t.team.id = :teamId order by lower(t.name) asc")
    List<Tag> findAllByTeamId(@Param("teamId") UUID teamId);

    @Query("select t from Tag t where t.id = :id and t.team.id = :teamId")
    Optional<Tag> findByIdAndTeamId(@Param("id") UUID id, @Param("teamId") UUID teamId);

    @Query("""
            select count(t) > 0 from Tag t
             where t.team.id = :teamId
               and lower(t.name) = lower(:name)
               and t.id <> :excludedId
            """)
    boolean existsOtherWithName(
            @Param("teamId") UUID teamId,
            @Param("name") String name,
            @Param("excludedId") UUID excludedId
    );

    /**
     * Creates the tag unless the team already has one with the same name (ignoring case).
     * Returns 0 when another writer got there first.
     */
    @Modifying
    @Query(value = """
            insert into tag (id, team_id, name, creator_id, created_at, updated_at)
            values (:id, :teamId, :name, :creatorId, :now, :now)
            on conflict do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("id") UUID id,
            @Param("teamId") UUID teamId,
            @Param("name") String name,
            @Param("creatorId") UUID creatorId,
            @Param("now") OffsetDateTime now
    );
}
