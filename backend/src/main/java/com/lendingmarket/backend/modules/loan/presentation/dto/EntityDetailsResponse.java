package com.lendingmarket.backend.modules.loan.presentation.dto;

public record EntityDetailsResponse(
        String entityName,
        String entityType,
        String entityTaxId,
        String borrowerRelationship
) {
}
