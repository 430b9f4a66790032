package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParticipantResponse(
        UUID participantId,
        UUID lenderId,
        String email,
        String lenderName,
        BigDecimal allocation,
        BigDecimal remainingBalance,
        BigDecimal totalRepaid,
        String status,
        OffsetDateTime invitedAt,
        OffsetDateTime respondedAt,
        PaymentEstimateResponse paymentEstimate,
        AchDetailResponse achDetails
) {
}
