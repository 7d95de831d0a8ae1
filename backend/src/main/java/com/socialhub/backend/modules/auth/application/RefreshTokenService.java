package com.socialhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.domain.RefreshToken;
import com.socialhub.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.socialhub.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues access/refresh pairs and rotates refresh tokens.
 *
 * <p>Each user owns at most one refresh token row. Login and refresh overwrite that row, so a
 * previously issued value stops resolving the moment a new one is handed out. Two refreshes of
 * the same value racing each other can both pass the expiry check; the last write wins.
 */
@Service
@Transactional
public class RefreshTokenService {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenService.class);

    static final String INVALID_REFRESH_TOKEN = "auth.invalid_refresh_token";
    static final String INVALID_REFRESH_TOKEN_MESSAGE = "Invalid or expired refresh token";

    private final RefreshTokenRepository refreshTokenRepository;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public RefreshTokenService(
            RefreshTokenRepository refreshTokenRepository,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public TokenPairResponse issueTokens(AppUser user) {
        String refreshToken = newRefreshTokenValue();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user, refreshToken);

        RefreshToken stored = refreshTokenRepository.findByUserId(user.getId())
                .orElseGet(() -> {
                    RefreshToken created = new RefreshToken();
                    created.setUser(user);
                    return created;
                });
        store(stored, refreshToken, tokens);
        return tokens;
    }

    public TokenPairResponse refresh(String refreshTokenValue) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        RefreshToken stored = refreshTokenRepository.findValidByToken(refreshTokenValue, now)
                .orElseThrow(() -> {
                    log.warn("Rejected refresh attempt with unknown or expired token");
                    return ProblemException.unauthorized(INVALID_REFRESH_TOKEN, INVALID_REFRESH_TOKEN_MESSAGE);
                });

        String rotated = newRefreshTokenValue();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(stored.getUser(), rotated);
        store(stored, rotated, tokens);
        return tokens;
    }

    private void store(RefreshToken row, String value, TokenPairResponse tokens) {
        row.setToken(value);
        row.setExpiresAt(tokens.issuedAt().plusSeconds(tokens.refreshExpiresIn()));
        refreshTokenRepository.save(row);
    }

    private String newRefreshTokenValue() {
        return UUID.randomUUID().toString();
    }
}
