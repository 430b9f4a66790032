package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record InviteLendersResponse(
        UUID loanId,
        int invitedCount,
        BigDecimal totalInvited,
        BigDecimal remainingAmount,
        List<ParticipantResponse> participants
) {
}
