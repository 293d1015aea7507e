package com.teamstash.backend.global.security;

import java.util.UUID;

/**
 * Identity asserted by the identity provider's signed token.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email, boolean emailVerified, String displayName) {
}
