package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

public record InviteLendersRequest(
        @NotEmpty(message = "lenders must not be empty")
        List<@Valid LenderInvitationRequest> lenders
) {
}
