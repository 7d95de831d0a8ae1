package com.socialhub.backend.modules.auth.application;

/**
 * Delivers password reset links out of band. Implementations are best-effort: the caller is
 * never told whether delivery succeeded.
 */
public interface PasswordResetMailer {

    void sendPasswordResetEmail(String email, String resetToken);
}
