package com.socialhub.backend.global.security;

import java.util.UUID;

import com.socialhub.backend.global.error.ProblemException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Resolves the caller id from an injected principal, failing with 401 when the request carried none.
     */
    public static UUID requireUserId(JwtAuthenticationPrincipal principal) {
        if (principal == null) {
            throw ProblemException.unauthorized("auth.authentication_required", "Authentication required");
        }
        return principal.userId();
    }
}
