package com.socialhub.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SecureTokensTest {

    @Test
    void producesRequestedLengthOverUrlSafeAlphabet() {
        String token = SecureTokens.urlSafe(64);

        assertThat(token).hasSize(64).matches("[A-Za-z0-9_-]{64}");
    }

    @Test
    void rejectsNonPositiveLength() {
        assertThatThrownBy(() -> SecureTokens.urlSafe(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
