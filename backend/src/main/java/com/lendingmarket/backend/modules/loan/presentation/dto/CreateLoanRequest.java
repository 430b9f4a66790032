package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.lendingmarket.backend.modules.loan.domain.PaymentFrequency;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateLoanRequest(
        @NotBlank(message = "loanName is required")
        @Size(max = 120, message = "loanName must be at most 120 characters")
        String loanName,
        @NotNull(message = "principal is required")
        @Digits(integer = 12, fraction = 2, message = "principal must have at most 2 decimal places")
        BigDecimal principal,
        @NotNull(message = "interestRate is required")
        @Digits(integer = 3, fraction = 2, message = "interestRate must have at most 2 decimal places")
        BigDecimal interestRate,
        @NotBlank(message = "purpose is required")
        @Size(max = 100, message = "purpose must be at most 100 characters")
        String purpose,
        @NotBlank(message = "description is required")
        @Size(max = 1000, message = "description must be at most 1000 characters")
        String description,
        @NotNull(message = "paymentFrequency is required")
        PaymentFrequency paymentFrequency,
        @NotNull(message = "termLengthMonths is required")
        @Min(value = 1, message = "termLengthMonths must be at least 1")
        @Max(value = 60, message = "termLengthMonths must be at most 60")
        Integer termLengthMonths,
        @NotNull(message = "startDate is required")
        LocalDate startDate,
        @Valid
        EntityDetailsRequest entityDetails,
        @Valid
        List<LenderInvitationRequest> lenders
) {
}
