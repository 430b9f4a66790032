package com.lendingmarket.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record TokenResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
