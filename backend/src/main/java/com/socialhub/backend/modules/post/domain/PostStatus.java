package com.socialhub.backend.modules.post.domain;

public enum PostStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}
