package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

public record InvitationDecisionResponse(
        UUID loanId,
        UUID participantId,
        String participantStatus,
        String loanStatus,
        BigDecimal totalInvited,
        BigDecimal totalFunded,
        BigDecimal fundingPercentage,
        boolean isFullyFunded
) {
}
