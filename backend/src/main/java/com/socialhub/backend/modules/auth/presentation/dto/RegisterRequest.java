package com.socialhub.backend.modules.auth.presentation.dto;

import com.socialhub.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "firstName is required") @Size(max = 100) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 100) String lastName,
        @NotBlank(message = "email is required") @Email(message = "Please enter a valid email address") String email,
        @NotBlank(message = "password is required")
        @Size(min = 6, message = "Password must be at least 6 characters long") String password,
        UserRole role
) {
}
