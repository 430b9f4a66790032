package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

public record PendingInvitationResponse(
        UUID participantId,
        UUID loanId,
        String loanName,
        String borrowerName,
        BigDecimal principal,
        BigDecimal interestRate,
        String purpose,
        String paymentFrequency,
        int termLengthMonths,
        LocalDate startDate,
        String loanStatus,
        BigDecimal fundingPercentage,
        BigDecimal allocation,
        PaymentEstimateResponse paymentEstimate,
        OffsetDateTime invitedAt
) {
}
