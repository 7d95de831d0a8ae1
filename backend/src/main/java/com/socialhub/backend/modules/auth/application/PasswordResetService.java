package com.socialhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.domain.ResetToken;
import com.socialhub.backend.modules.auth.infrastructure.persistence.ResetTokenRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and validates password reset tokens.
 * Issuing a new token leaves earlier ones usable until they expire, and a consumed token is not deleted.
 */
@Service
@Transactional
public class PasswordResetService {

    public static final int RESET_TOKEN_LENGTH = 64;
    static final String INVALID_RESET_TOKEN = "auth.invalid_reset_token";

    private final ResetTokenRepository resetTokenRepository;
    private final Duration resetTokenTtl;
    private final Clock clock;

    public PasswordResetService(
            ResetTokenRepository resetTokenRepository,
            @Value("${app.security.reset-token-ttl:PT1H}") Duration resetTokenTtl,
            Clock clock
    ) {
        this.resetTokenRepository = resetTokenRepository;
        this.resetTokenTtl = resetTokenTtl;
        this.clock = clock;
    }

    public String issue(AppUser user) {
        ResetToken token = new ResetToken();
        token.setUserId(user.getId());
        token.setToken(SecureTokens.urlSafe(RESET_TOKEN_LENGTH));
        token.setExpiresAt(OffsetDateTime.now(clock).plus(resetTokenTtl));
        resetTokenRepository.save(token);
        return token.getToken();
    }

    @Transactional(readOnly = true)
    public ResetToken requireValid(String tokenValue) {
        return resetTokenRepository.findValidByToken(tokenValue, OffsetDateTime.now(clock))
                .orElseThrow(() -> ProblemException.unauthorized(INVALID_RESET_TOKEN, "Invalid link"));
    }
}
