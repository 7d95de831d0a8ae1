package com.socialhub.backend.modules.auth.application;

import java.util.Locale;
import java.util.UUID;

import com.socialhub.backend.global.common.MessageResponse;
import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.domain.ResetToken;
import com.socialhub.backend.modules.auth.domain.UserRole;
import com.socialhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.socialhub.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.LoginRequest;
import com.socialhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.socialhub.backend.modules.auth.presentation.dto.RefreshRequest;
import com.socialhub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.socialhub.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String USER_EXISTS = "auth.user_exists";
    static final String INVALID_CREDENTIALS = "auth.invalid_credentials";
    static final String INVALID_CREDENTIALS_MESSAGE = "Invalid credentials";
    static final String USER_NOT_FOUND = "auth.user_not_found";
    static final String WRONG_CREDENTIALS = "auth.wrong_credentials";

    static final String PASSWORD_CHANGED = "Password changed";
    static final String FORGOT_PASSWORD_ACK = "If user exists, they will receive an email";
    static final String PASSWORD_RESET = "Password reset successfully.";

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final RefreshTokenService refreshTokenService;
    private final PasswordResetService passwordResetService;
    private final PasswordResetMailer passwordResetMailer;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            RefreshTokenService refreshTokenService,
            PasswordResetService passwordResetService,
            PasswordResetMailer passwordResetMailer
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.refreshTokenService = refreshTokenService;
        this.passwordResetService = passwordResetService;
        this.passwordResetMailer = passwordResetMailer;
    }

    public UserResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict(USER_EXISTS, "User already exists");
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(request.role() != null ? request.role() : UserRole.USER);
        user.setProfilePicture("");

        AppUser saved;
        try {
            saved = appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration of the same email
            throw ProblemException.conflict(USER_EXISTS, "User already exists");
        }
        log.info("Registered user {} with role {}", saved.getId(), saved.getRole());
        return UserResponse.from(saved);
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(this::invalidCredentials);

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.warn("Failed login for user {}", user.getId());
            throw invalidCredentials();
        }

        TokenPairResponse tokens = refreshTokenService.issueTokens(user);
        return new LoginResponse(UserResponse.from(user), tokens);
    }

    public TokenPairResponse refresh(RefreshRequest request) {
        return refreshTokenService.refresh(request.token());
    }

    public MessageResponse changePassword(UUID userId, ChangePasswordRequest request) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User not found"));

        if (!passwordEncoder.matches(request.oldPassword(), user.getPasswordHash())) {
            throw ProblemException.unauthorized(WRONG_CREDENTIALS, "Wrong credentials");
        }

        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        appUserRepository.save(user);
        log.info("Password changed for user {}", userId);
        return MessageResponse.of(PASSWORD_CHANGED);
    }

    public MessageResponse forgotPassword(ForgotPasswordRequest request) {
        appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .ifPresent(user -> {
                    String token = passwordResetService.issue(user);
                    log.info("Password reset token issued for user {}", user.getId());
                    mailAfterCommit(user.getEmail(), token);
                });
        return MessageResponse.of(FORGOT_PASSWORD_ACK);
    }

    public MessageResponse resetPassword(ResetPasswordRequest request) {
        ResetToken resetToken = passwordResetService.requireValid(request.resetToken());

        AppUser user = appUserRepository.findById(resetToken.getUserId())
                .orElseThrow(() -> ProblemException.notFound(USER_NOT_FOUND, "User not found"));

        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        appUserRepository.save(user);
        log.info("Password reset for user {}", user.getId());
        return MessageResponse.of(PASSWORD_RESET);
    }

    /**
     * The link must only leave once its token row is durable, so delivery waits for the commit.
     */
    private void mailAfterCommit(String email, String token) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            passwordResetMailer.sendPasswordResetEmail(email, token);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                passwordResetMailer.sendPasswordResetEmail(email, token);
            }
        });
    }

    private ProblemException invalidCredentials() {
        return ProblemException.unauthorized(INVALID_CREDENTIALS, INVALID_CREDENTIALS_MESSAGE);
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
