package com.lendingmarket.backend.modules.repayment.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SubmitRepaymentRequest(
        @NotNull(message = "loanId is required") UUID loanId,
        @NotNull(message = "participantId is required") UUID participantId,
        @NotNull(message = "amount is required")
        @Digits(integer = 12, fraction = 2, message = "amount must have at most 2 decimal places")
        BigDecimal amount,
        @NotNull(message = "paymentDate is required") LocalDate paymentDate,
        @Size(max = 500, message = "notes must be at most 500 characters") String notes,
        @Size(max = 500, message = "proofReference must be at most 500 characters") String proofReference
) {
}
