package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import com.lendingmarket.backend.modules.loan.domain.LoanTermsCalculator.AmortizationEntry;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Loan as seen by one requester. A lender's view lists only their own participation and amortization.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoanDetailsResponse(
        LoanSummaryResponse loan,
        String viewerRole,
        List<ParticipantResponse> participants,
        List<LocalDate> paymentSchedule,
        List<AmortizationEntry> amortizationSchedule
) {
    public static final String VIEWER_BORROWER = "BORROWER";
    public static final String VIEWER_LENDER = "LENDER";
    public static final String VIEWER_ADMIN = "ADMIN";
}
