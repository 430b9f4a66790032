package com.lendingmarket.backend.modules.loan.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Legal entity behind a business loan.
 */
public record EntityDetailsRequest(
        @Size(max = 200) String entityName,
        @Size(max = 32) String entityType,
        @Size(max = 50) String entityTaxId,
        @Size(max = 32) String borrowerRelationship
) {
}
