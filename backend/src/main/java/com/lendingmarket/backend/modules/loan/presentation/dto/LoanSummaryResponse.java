package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoanSummaryResponse(
        UUID loanId,
        String loanName,
        UUID borrowerId,
        String borrowerName,
        BigDecimal principal,
        BigDecimal interestRate,
        String purpose,
        String description,
        String paymentFrequency,
        int termLengthMonths,
        LocalDate startDate,
        LocalDate maturityDate,
        int totalPayments,
        String status,
        BigDecimal totalInvited,
        BigDecimal totalFunded,
        BigDecimal totalRepaid,
        BigDecimal fundingPercentage,
        BigDecimal remainingAmount,
        boolean isFullyFunded,
        int participantCount,
        int acceptedCount,
        EntityDetailsResponse entityDetails,
        OffsetDateTime createdAt,
        OffsetDateTime activatedAt,
        OffsetDateTime completedAt
) {
}
