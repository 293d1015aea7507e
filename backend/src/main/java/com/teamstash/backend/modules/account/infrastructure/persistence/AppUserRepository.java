package com.teamstash.backend.modules.account.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.teamstash.backend.modules.account.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    /**
     * Verified accounts holding the address, oldest first. Unverified claims never count as ownership
     * of an address, and the identity provider is not trusted to keep verified addresses unique.
     */
    @Query("""
            select u.id from AppUser u
             where lower(u.email) = lower(:email)
               and u.emailVerified = true
             order by u.createdAt asc, u.id asc
            """)
    List<UUID> findVerifiedIdsByEmail(@Param("email") String email);

    List<AppUser> findByIdIn(Collection<UUID> ids);

    /**
     * Inserts the account or refreshes its claims. Rows whose claims are unchanged are left untouched.
     */
    @Modifying
    @Query(value = """
            insert into app_user (id, email, email_verified, display_name, created_at, updated_at)
            values (:id, :email, :emailVerified, :displayName, :now, :now)
            on conflict (id) do update
               set email = excluded.email,
                   email_verified = excluded.email_verified,
                   display_name = excluded.display_name,
                   updated_at = excluded.updated_at
             where app_user.email is distinct from excluded.email
                or app_user.email_verified is distinct from excluded.email_verified
                or app_user.display_name is distinct from excluded.display_name
            """, nativeQuery = true)
    int upsertFromClaims(
            @Param("id") UUID id,
            @Param("email") String email,
            @Param("emailVerified") boolean emailVerified,
            @Param("displayName") String displayName,
            @Param("now") OffsetDateTime now
    );
}
