package com.lendingmarket.backend.modules.loan.presentation.dto;

public record AchDetailResponse(
        String bankName,
        String accountType,
        String routingNumber,
        String accountNumber,
        String specialInstructions
) {
}
