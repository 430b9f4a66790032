package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public record LenderSearchResponse(
        UUID lenderId,
        String name,
        String email,
        int investmentCount,
        BigDecimal totalLent,
        OffsetDateTime lastInvitedAt
) {
}
