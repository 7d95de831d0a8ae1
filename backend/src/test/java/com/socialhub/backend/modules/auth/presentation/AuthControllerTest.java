package com.socialhub.backend.modules.auth.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.socialhub.backend.global.common.MessageResponse;
import com.socialhub.backend.global.error.ProblemException;
import com.socialhub.backend.global.error.RestExceptionHandler;
import com.socialhub.backend.global.security.JwtAuthenticationPrincipal;
import com.socialhub.backend.modules.auth.application.AuthService;
import com.socialhub.backend.modules.auth.domain.UserRole;
import com.socialhub.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.LoginRequest;
import com.socialhub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private AuthService authService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AuthController(authService))
                .setControllerAdvice(new RestExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void registerAnswersCreatedWithoutPassword() throws Exception {
        UUID id = UUID.randomUUID();
        when(authService.register(any(RegisterRequest.class))).thenReturn(
                new UserResponse(id, "kim@example.com", "Kim", "Lee", UserRole.USER, false, "", null, null));

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"firstName":"Kim","lastName":"Lee","email":"kim@example.com","password":"secret1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.email").value("kim@example.com"))
                .andExpect(jsonPath("$.password").doesNotExist())
                .andExpect(jsonPath("$.passwordHash").doesNotExist());
    }

    @Test
    void registerValidatesInput() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"firstName":"Kim","lastName":"Lee","email":"not-an-email","password":"123"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
        verifyNoInteractions(authService);
    }

    @Test
    void loginFailureIsRenderedAsProblem() throws Exception {
        when(authService.login(any(LoginRequest.class)))
                .thenThrow(ProblemException.unauthorized("auth.invalid_credentials", "Invalid credentials"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"kim@example.com","password":"wrong"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_credentials"))
                .andExpect(jsonPath("$.detail").value("Invalid credentials"))
                .andExpect(jsonPath("$.instance").value("/auth/login"));
    }

    @Test
    void changePasswordUsesAuthenticatedUser() throws Exception {
        UUID userId = UUID.randomUUID();
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(userId, "kim@example.com", "USER");
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                principal, "token", List.of(new SimpleGrantedAuthority("ROLE_USER"))));
        when(authService.changePassword(eq(userId), any(ChangePasswordRequest.class)))
                .thenReturn(MessageResponse.of("Password changed"));

        mockMvc.perform(put("/auth/change-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"oldPassword":"secret1","newPassword":"secret2"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password changed"));
        verify(authService).changePassword(eq(userId), any(ChangePasswordRequest.class));
    }

    @Test
    void changePasswordWithoutPrincipalIsUnauthorized() throws Exception {
        mockMvc.perform(put("/auth/change-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"oldPassword":"secret1","newPassword":"secret2"}
                                """))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(authService);
    }
}
