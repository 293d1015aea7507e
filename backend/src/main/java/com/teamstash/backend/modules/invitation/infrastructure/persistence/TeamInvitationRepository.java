package com.teamstash.backend.modules.invitation.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.teamstash.backend.modules.invitation.domain.InvitationStatus;
import com.teamstash.backend.modules.invitation.domain.TeamInvitation;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamInvitationRepository extends JpaRepository<TeamInvitation, UUID> {

    @Query("""
            select count(i) > 0 from TeamInvitation i
             where i.team.id = :teamId
               and i.emailInvited = :email
               and i.status = com.teamstash.backend.modules.invitation.domain.InvitationStatus.PENDING
            """)
    boolean existsPending(@Param("teamId") UUID teamId, @Param("email") String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from TeamInvitation i where i.id = :id")
    Optional<TeamInvitation> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select i from TeamInvitation i
              join fetch i.team t
             where i.emailInvited = :email
               and i.status = com.teamstash.backend.modules.invitation.domain.InvitationStatus.PENDING
             order by i.createdAt desc
            """)
    List<TeamInvitation> findPendingByEmail(@Param("email") String email);

    @Query("""
            select i from TeamInvitation i
              join fetch i.team t
             where t.id = :teamId
               and i.status = :status
             order by i.createdAt desc
            """)
    List<TeamInvitation> findByTeamIdAndStatus(@Param("teamId") UUID teamId, @Param("status") InvitationStatus status);

    @Query("""
            select i from TeamInvitation i
              join fetch i.team t
             where t.id = :teamId
             order by i.createdAt desc
            """)
    List<TeamInvitation> findByTeamId(@Param("teamId") UUID teamId);
}
