package com.lendingmarket.backend.modules.dashboard.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record LenderPortfolioResponse(
        List<PortfolioItem> portfolio,
        int totalCount,
        PortfolioSummary summary
) {

    public record PortfolioItem(
            UUID loanId,
            UUID participantId,
            String loanName,
            String borrowerName,
            BigDecimal principal,
            BigDecimal allocation,
            BigDecimal interestRate,
            String purpose,
            String description,
            String paymentFrequency,
            int termLengthMonths,
            LocalDate startDate,
            LocalDate maturityDate,
            int totalPayments,
            String loanStatus,
            String participationStatus,
            OffsetDateTime invitedAt,
            OffsetDateTime respondedAt,
            BigDecimal totalFunded,
            BigDecimal fundingPercentage,
            BigDecimal remainingBalance,
            BigDecimal expectedAnnualReturn,
            BigDecimal expectedMonthlyReturn
    ) {
    }

    public record PortfolioSummary(
            BigDecimal totalInvested,
            BigDecimal totalExpectedReturns,
            int pendingInvitations,
            int activeInvestments
    ) {
    }
}
