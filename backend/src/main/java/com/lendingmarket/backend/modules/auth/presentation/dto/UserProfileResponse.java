package com.lendingmarket.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String email,
        String name,
        List<String> capabilities,
        boolean isBorrower,
        boolean isLender,
        boolean isAdmin,
        String status,
        OffsetDateTime createdAt
) {
}
