package com.lendingmarket.backend.modules.loan.presentation.dto;

/**
 * ACH banking details supplied on acceptance. Field rules are enforced by the lender service.
 */
public record AcceptInvitationRequest(
        String bankName,
        String accountType,
        String routingNumber,
        String accountNumber,
        String specialInstructions
) {
}
