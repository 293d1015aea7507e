package com.teamstash.backend.modules.account.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.teamstash.backend.modules.account.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Verifies bearer tokens issued by the identity provider. Issuing tokens is not this service's job.
 */
@Service
public class JwtTokenService {

    static final String EMAIL_CLAIM = "email";
    static final String EMAIL_VERIFIED_CLAIM = "email_verified";
    static final String NAME_CLAIM = "name";

    private final JwtTokenProvider tokenProvider;
    private final Duration allowedClockSkew;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.allowed-clock-skew-seconds:30}") long allowedClockSkewSeconds,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.allowedClockSkew = Duration.ofSeconds(allowedClockSkewSeconds);
        this.clock = clock;
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clockSkewSeconds(allowedClockSkew.getSeconds())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(EMAIL_CLAIM, String.class);
            if (email == null || email.isBlank()) {
                throw new InvalidTokenException("Access token carries no email claim", null);
            }
            Boolean verified = claims.get(EMAIL_VERIFIED_CLAIM, Boolean.class);
            String displayName = claims.get(NAME_CLAIM, String.class);
            if (claims.getExpiration() == null) {
                throw new InvalidTokenException("Access token carries no expiry", null);
            }
            Instant expiresAt = claims.getExpiration().toInstant();

            return new ParsedToken(
                    userId,
                    email.trim(),
                    Boolean.TRUE.equals(verified),
                    displayName,
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, String email, boolean emailVerified, String displayName, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
