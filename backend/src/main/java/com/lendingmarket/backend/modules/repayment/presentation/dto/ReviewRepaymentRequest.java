package com.lendingmarket.backend.modules.repayment.presentation.dto;

import com.lendingmarket.backend.modules.repayment.domain.ReviewDecision;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ReviewRepaymentRequest(
        @NotNull(message = "decision is required") ReviewDecision decision,
        @Size(max = 1000, message = "notes must be at most 1000 characters") String notes
) {
}
