package com.socialhub.backend.modules.auth.presentation;

import com.socialhub.backend.global.common.MessageResponse;
import com.socialhub.backend.global.security.JwtAuthenticationPrincipal;
import com.socialhub.backend.global.security.SecurityUtils;
import com.socialhub.backend.modules.auth.application.AuthService;
import com.socialhub.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.LoginRequest;
import com.socialhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.socialhub.backend.modules.auth.presentation.dto.RefreshRequest;
import com.socialhub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.socialhub.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.socialhub.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register", description = "Creates an account. The password is stored as a BCrypt hash.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Invalid input")
    })
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @Operation(summary = "Login", description = "Returns the user and a fresh access/refresh token pair.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @Operation(summary = "Rotate refresh token", description = "Exchanges a live refresh token for a new pair. The old value stops working.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rotated"),
            @ApiResponse(responseCode = "401", description = "Invalid or expired refresh token")
    })
    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @Operation(summary = "Change password")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "401", description = "Missing token or wrong old password"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PutMapping("/change-password")
    public ResponseEntity<MessageResponse> changePassword(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request
    ) {
        return ResponseEntity.ok(authService.changePassword(SecurityUtils.requireUserId(principal), request));
    }

    @Operation(summary = "Request a password reset link", description = "Always answers with the same message.")
    @PostMapping("/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.ok(authService.forgotPassword(request));
    }

    @Operation(summary = "Reset password with a mailed token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password reset"),
            @ApiResponse(responseCode = "401", description = "Invalid or expired link"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PutMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return ResponseEntity.ok(authService.resetPassword(request));
    }
}
