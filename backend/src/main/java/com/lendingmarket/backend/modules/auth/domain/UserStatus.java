package com.lendingmarket.backend.modules.auth.domain;

public enum UserStatus {
    ACTIVE,
    INACTIVE
}
