package com.socialhub.backend.modules.auth.presentation.dto;

public record LoginResponse(UserResponse user, TokenPairResponse tokens) {
}
