package com.socialhub.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.socialhub.backend.modules.auth.domain.AppUser;
import com.socialhub.backend.modules.auth.domain.UserRole;
import com.socialhub.backend.modules.post.presentation.dto.PostResponse;

public record ProfileResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        UserRole role,
        boolean isPrivate,
        String profilePicture,
        long followers,
        long following,
        List<PostResponse> posts,
        OffsetDateTime createdAt
) {

    public static ProfileResponse of(AppUser user, long followers, long following, List<PostResponse> posts) {
        return new ProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole(),
                user.isPrivateAccount(),
                user.getProfilePicture(),
                followers,
                following,
                posts,
                user.getCreatedAt()
        );
    }
}
