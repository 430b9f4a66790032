package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record LenderInvitationRequest(
        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address")
        String email,
        @NotNull(message = "amount is required")
        @Digits(integer = 12, fraction = 2, message = "amount must have at most 2 decimal places")
        BigDecimal amount
) {
}
