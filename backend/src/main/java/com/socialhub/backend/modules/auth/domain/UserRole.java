package com.socialhub.backend.modules.auth.domain;

public enum UserRole {
    ADMIN,
    USER
}
