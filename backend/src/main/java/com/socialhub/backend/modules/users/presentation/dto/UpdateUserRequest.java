package com.socialhub.backend.modules.users.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.socialhub.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateUserRequest(
        @Size(min = 1, max = 100) String firstName,
        @Size(min = 1, max = 100) String lastName,
        @Email(message = "Please enter a valid email address") String email,
        UserRole role,
        @JsonAlias("is_private") Boolean isPrivate
) {
}
