package com.teamstash.backend.modules.provider.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.modules.provider.domain.Provider;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProviderRepository extends JpaRepository<Provider, UUID> {

    /**
     * Exact, case-sensitive name match within the team.
     */
    @Query("select p from Provider p where p.team.id = :teamId and p.name = :name")
    Optional<Provider> findByTeamIdAndName(@Param("teamId") UUID teamId, @Param("name") String name);

    @Query("select p from Provider p where p.team.id = :teamId order by p.name asc")
    List<Provider> findAllByTeamId(@Param("teamId") UUID teamId);

    @Query("select p from Provider p where p.id = :id and p.team.id = :teamId")
    Optional<Provider> findByIdAndTeamId(@Param("id") UUID id, @Param("teamId") UUID teamId);
}
