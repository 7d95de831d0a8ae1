package com.socialhub.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Owns the HS256 key for access tokens. The secret may be Base64 or raw UTF-8 text and must
 * carry at least 256 bits either way.
 */
@Component
public class JwtTokenProvider {

    static final int MIN_KEY_BYTES = 32;
    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        byte[] keyBytes = decode(secretString);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException(
                    "jwt.secret must decode to at least " + MIN_KEY_BYTES + " bytes, got " + keyBytes.length);
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public String sign(JwtBuilder builder) {
        return builder.signWith(secretKey, SIG.HS256).compact();
    }

    /**
     * Verifies signature and expiry against the given clock.
     *
     * @throws io.jsonwebtoken.JwtException when the token is malformed, tampered or expired
     */
    public Claims verify(String token, Clock clock) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    private static byte[] decode(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret is missing");
        }
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException notBase64) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }
}
