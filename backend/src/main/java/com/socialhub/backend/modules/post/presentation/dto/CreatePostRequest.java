package com.socialhub.backend.modules.post.presentation.dto;

import java.util.List;

import com.socialhub.backend.modules.post.domain.PostStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePostRequest(
        @NotBlank(message = "title is required") @Size(max = 200) String title,
        @NotBlank(message = "content is required") String content,
        PostStatus status,
        List<@NotBlank String> mediaUrls,
        Boolean pinned
) {
}
