package com.lendingmarket.backend.modules.repayment.domain;

public enum ReviewDecision {
    APPROVED,
    REJECTED;

    public RepaymentStatus toStatus() {
        return this == APPROVED ? RepaymentStatus.APPROVED : RepaymentStatus.REJECTED;
    }
}
