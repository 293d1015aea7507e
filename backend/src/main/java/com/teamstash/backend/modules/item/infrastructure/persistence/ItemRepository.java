package com.teamstash.backend.modules.item.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.modules.item.domain.Item;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ItemRepository extends JpaRepository<Item, UUID> {

    @Query("""
            select i from Item i
              left join fetch i.category c
              left join fetch i.provider p
             where i.team.id = :teamId
             order by i.expirationDate asc, lower(i.name) asc
            """)
    List<Item> findAllByTeamId(@Param("teamId") UUID teamId);

    @Query("""
            select i from Item i
              left join fetch i.category c
              left join fetch i.provider p
             where i.id = :id
               and i.team.id = :teamId
            """)
    Optional<Item> findByIdAndTeamId(@Param("id") UUID id, @Param("teamId") UUID teamId);
}
