package com.socialhub.backend.modules.users.presentation.dto;

import java.util.List;

import com.socialhub.backend.modules.auth.presentation.dto.UserResponse;

/**
 * One page of search hits. {@code page} is 1-based.
 */
public record UserSearchResponse(
        List<UserResponse> items,
        long total,
        int page,
        int limit
) {
}
