package com.socialhub.backend.modules.profile.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update. Null fields are left unchanged.
 */
public record EditProfileRequest(
        @Size(min = 1, max = 100, message = "First name must not be empty") String firstName,
        @Size(min = 1, max = 100, message = "Last name must not be empty") String lastName,
        @Email(message = "Please enter a valid email address") String email,
        @JsonAlias("is_private") Boolean isPrivate
) {
}
