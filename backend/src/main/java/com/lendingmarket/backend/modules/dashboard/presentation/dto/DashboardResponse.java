package com.lendingmarket.backend.modules.dashboard.presentation.dto;

import java.math.BigDecimal;

/**
 * Either section is null when the caller lacks the matching capability.
 */
public record DashboardResponse(
        BorrowerStats borrower,
        LenderStats lender
) {

    public record BorrowerStats(
            int activeLoans,
            BigDecimal totalBorrowed,
            int pendingRequests,
            BigDecimal averageInterestRate
    ) {
    }

    public record LenderStats(
            int pendingInvitations,
            int activeInvestments,
            BigDecimal totalLent,
            BigDecimal expectedReturns,
            BigDecimal outstandingBalance
    ) {
    }
}
