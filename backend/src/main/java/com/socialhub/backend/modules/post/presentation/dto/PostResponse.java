package com.socialhub.backend.modules.post.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.socialhub.backend.modules.post.domain.Post;
import com.socialhub.backend.modules.post.domain.PostStatus;

public record PostResponse(
        UUID id,
        UUID userId,
        String title,
        String content,
        PostStatus status,
        List<String> mediaUrls,
        boolean pinned,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PostResponse from(Post post) {
        return new PostResponse(
                post.getId(),
                post.getUser().getId(),
                post.getTitle(),
                post.getContent(),
                post.getStatus(),
                List.copyOf(post.getMediaUrls()),
                post.isPinned(),
                post.getCreatedAt(),
                post.getUpdatedAt()
        );
    }
}
