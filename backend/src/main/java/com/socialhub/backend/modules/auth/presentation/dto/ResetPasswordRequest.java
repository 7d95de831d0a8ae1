package com.socialhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "resetToken is required") String resetToken,
        @NotBlank @Size(min = 6, message = "Password must be at least 6 characters long") String newPassword
) {
}
