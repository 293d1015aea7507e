package com.teamstash.backend.modules.account.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

import com.teamstash.backend.global.error.ProblemException;
import com.teamstash.backend.global.security.JwtAuthenticationPrincipal;
import com.teamstash.backend.modules.account.domain.AppUser;
import com.teamstash.backend.modules.account.infrastructure.persistence.AppUserRepository;
import com.teamstash.backend.modules.account.presentation.dto.UserProfileResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AccountService {

    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public AccountService(AppUserRepository appUserRepository, Clock clock) {
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    public void syncAccount(JwtAuthenticationPrincipal principal) {
        appUserRepository.upsertFromClaims(
                principal.userId(),
                normalizeEmail(principal.email()),
                principal.emailVerified(),
                principal.displayName(),
                OffsetDateTime.now(clock)
        );
    }

    @Transactional(readOnly = true)
    public AppUser getAccount(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "account.not_found",
                        "No account is registered for the current principal."));
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = getAccount(userId);
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.isEmailVerified(),
                user.getDisplayName(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
