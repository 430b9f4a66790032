package com.lendingmarket.backend.modules.loan.domain;

public enum LoanStatus {
    DRAFT,
    PENDING,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isOpenForInvitations() {
        return this == DRAFT || this == PENDING;
    }
}
