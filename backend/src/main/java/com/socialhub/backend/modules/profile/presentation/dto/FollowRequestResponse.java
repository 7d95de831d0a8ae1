package com.socialhub.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record FollowRequestResponse(
        UUID requestId,
        UUID requesterId,
        String firstName,
        String lastName,
        String profilePicture,
        OffsetDateTime requestedAt
) {
}
