package com.socialhub.backend.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.domain.ResetToken;
import com.socialhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.socialhub.backend.modules.auth.infrastructure.persistence.ResetTokenRepository;
import com.socialhub.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "secret1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private ResetTokenRepository resetTokenRepository;

    @Test
    void duplicateRegistrationIsRejectedAndPasswordIsHashed() throws Exception {
        register("liam@example.com");

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody("LIAM@example.com")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("auth.user_exists"));

        AppUser stored = appUserRepository.findByEmailIgnoreCase("liam@example.com").orElseThrow();
        assertThat(stored.getPasswordHash()).isNotEqualTo(PASSWORD).startsWith("$2");
    }

    @Test
    void loginFailuresLookIdentical() throws Exception {
        register("mia@example.com");

        JsonNode wrongPassword = readBody(mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("mia@example.com", "not-it")))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString());
        JsonNode unknownEmail = readBody(mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("nobody@example.com", PASSWORD)))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString());

        assertThat(wrongPassword.path("code")).isEqualTo(unknownEmail.path("code"));
        assertThat(wrongPassword.path("detail")).isEqualTo(unknownEmail.path("detail"));
    }

    @Test
    void refreshTokenCannotBeReplayedAfterRotation() throws Exception {
        register("noah@example.com");
        String refreshToken = login("noah@example.com", PASSWORD).path("tokens").path("refreshToken").asText();

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + refreshToken + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refreshToken").isNotEmpty());

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + refreshToken + "\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_refresh_token"));
    }

    @Test
    void changedPasswordReplacesOldOne() throws Exception {
        register("olivia@example.com");
        String accessToken = login("olivia@example.com", PASSWORD).path("tokens").path("accessToken").asText();

        mockMvc.perform(put("/auth/change-password")
                        .header("Authorization", "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"oldPassword\":\"secret1\",\"newPassword\":\"secret2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password changed"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("olivia@example.com", "secret2")))
                .andExpect(status().isOk());
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("olivia@example.com", PASSWORD)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void changePasswordRequiresBearerToken() throws Exception {
        mockMvc.perform(put("/auth/change-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"oldPassword\":\"secret1\",\"newPassword\":\"secret2\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void forgotAndResetPasswordFlow() throws Exception {
        register("paul@example.com");

        mockMvc.perform(post("/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"paul@example.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("If user exists, they will receive an email"));
        mockMvc.perform(post("/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ghost@example.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("If user exists, they will receive an email"));

        ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
        verify(passwordResetMailer).sendPasswordResetEmail(eq("paul@example.com"), token.capture());

        mockMvc.perform(put("/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resetToken\":\"" + token.getValue() + "\",\"newPassword\":\"brand-new\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password reset successfully."));
        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("paul@example.com", "brand-new")))
                .andExpect(status().isOk());
    }

    @Test
    void expiredResetTokenIsRejected() throws Exception {
        register("quinn@example.com");
        AppUser user = appUserRepository.findByEmailIgnoreCase("quinn@example.com").orElseThrow();
        ResetToken expired = new ResetToken();
        expired.setUserId(user.getId());
        expired.setToken("expired-token-value");
        expired.setExpiresAt(OffsetDateTime.now().minusMinutes(1));
        resetTokenRepository.save(expired);

        mockMvc.perform(put("/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resetToken\":\"expired-token-value\",\"newPassword\":\"brand-new\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid link"));
    }

    @Test
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    private void register(String email) throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(email)))
                .andExpect(status().isCreated());
    }

    private JsonNode login(String email, String password) throws Exception {
        return readBody(mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email, password)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
    }

    private JsonNode readBody(String body) throws Exception {
        return objectMapper.readTree(body);
    }

    private static String registerBody(String email) {
        return "{\"firstName\":\"Test\",\"lastName\":\"User\",\"email\":\"" + email + "\",\"password\":\"" + PASSWORD + "\"}";
    }

    private static String loginBody(String email, String password) {
        return "{\"email\":\"" + email + "\",\"password\":\"" + password + "\"}";
    }
}
