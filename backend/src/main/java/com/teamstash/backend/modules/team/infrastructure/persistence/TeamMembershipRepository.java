package com.teamstash.backend.modules.team.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.modules.team.domain.TeamMembership;
import com.teamstash.backend.modules.team.domain.TeamMembershipId;
import com.teamstash.backend.modules.team.domain.TeamRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamMembershipRepository extends JpaRepository<TeamMembership, TeamMembershipId> {

    /**
     * Every team the principal belongs to, oldest membership first. This order defines the fallback active team.
     */
    @Query("""
            select m from TeamMembership m
              join fetch m.team t
             where m.id.memberId = :memberId
             order by m.joinedAt asc, t.createdAt asc, t.id asc
            """)
    List<TeamMembership> findAllByMemberIdWithTeam(@Param("memberId") UUID memberId);

    @Query("""
            select m.role from TeamMembership m
             where m.id.teamId = :teamId
               and m.id.memberId = :memberId
            """)
    Optional<TeamRole> findRole(@Param("teamId") UUID teamId, @Param("memberId") UUID memberId);

    @Query("""
            select m from TeamMembership m
             where m.id.teamId = :teamId
             order by m.joinedAt asc, m.id.memberId asc
            """)
    List<TeamMembership> findAllByTeamId(@Param("teamId") UUID teamId);

    @Query("select count(m) from TeamMembership m where m.id.teamId = :teamId and m.role = :role")
    long countByTeamIdAndRole(@Param("teamId") UUID teamId, @Param("role") TeamRole role);

    /**
     * Adds the membership unless the pair already exists. Returns 0 for an existing pair so that
     * a concurrent duplicate does not abort the surrounding transaction.
     */
    @Modifying
    @Query(value = """
            insert into team_member (team_id, member_id, role, joined_at)
            values (:teamId, :memberId, :role, :joinedAt)
            on conflict (team_id, member_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("teamId") UUID teamId,
            @Param("memberId") UUID memberId,
            @Param("role") String role,
            @Param("joinedAt") OffsetDateTime joinedAt
    );
}
