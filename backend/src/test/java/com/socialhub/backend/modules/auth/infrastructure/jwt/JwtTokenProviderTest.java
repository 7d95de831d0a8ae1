package com.socialhub.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SignatureException;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void rawTextSecretSignsAndVerifies() {
        JwtTokenProvider provider = new JwtTokenProvider("raw-text-secret-for-socialhub-provider-tests-42");

        String token = provider.sign(Jwts.builder()
                .subject("user-1")
                .expiration(Date.from(NOW.plusSeconds(60))));

        Claims claims = provider.verify(token, CLOCK);
        assertThat(claims.getSubject()).isEqualTo("user-1");
    }

    @Test
    void base64SecretIsDecodedBeforeUse() {
        byte[] key = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);
        JwtTokenProvider encoded = new JwtTokenProvider(Base64.getEncoder().encodeToString(key));

        String token = encoded.sign(Jwts.builder().subject("user-2").expiration(Date.from(NOW.plusSeconds(60))));

        assertThat(encoded.verify(token, CLOCK).getSubject()).isEqualTo("user-2");
    }

    @Test
    void shortSecretIsRejected() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short-secret!"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 32 bytes");
    }

    @Test
    void tokenFromAnotherKeyFailsVerification() {
        JwtTokenProvider signer = new JwtTokenProvider("first-secret-for-socialhub-provider-tests-0001!");
        JwtTokenProvider verifier = new JwtTokenProvider("second-secret-for-socialhub-provider-tests-0002!");
        String token = signer.sign(Jwts.builder().subject("user-3").expiration(Date.from(NOW.plusSeconds(60))));

        assertThatThrownBy(() -> verifier.verify(token, CLOCK)).isInstanceOf(SignatureException.class);
    }

    @Test
    void expiryIsJudgedAgainstTheGivenClock() {
        JwtTokenProvider provider = new JwtTokenProvider("raw-text-secret-for-socialhub-provider-tests-42");
        String token = provider.sign(Jwts.builder().subject("user-4").expiration(Date.from(NOW.plusSeconds(60))));

        Clock later = Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC);
        assertThatThrownBy(() -> provider.verify(token, later)).isInstanceOf(ExpiredJwtException.class);
    }
}
