package com.socialhub.backend.modules.post.presentation.dto;

import java.util.List;

import com.socialhub.backend.modules.post.domain.PostStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Null fields keep their current value.
 */
public record EditPostRequest(
        @Size(min = 1, max = 200) String title,
        @Size(min = 1) String content,
        PostStatus status,
        List<@NotBlank String> mediaUrls,
        Boolean pinned
) {
}
