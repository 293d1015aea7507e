package com.teamstash.backend.modules.account.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Shared HMAC key used to verify identity-provider tokens. Accepts Base64 or raw text secrets.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        this.secretKey = new SecretKeySpec(decode(secretString), HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] decode(String secretString) {
        try {
            return Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            return secretString.getBytes(StandardCharsets.UTF_8);
        }
    }
}
