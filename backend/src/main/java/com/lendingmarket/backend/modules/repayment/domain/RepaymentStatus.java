package com.lendingmarket.backend.modules.repayment.domain;

public enum RepaymentStatus {
    PENDING,
    APPROVED,
    REJECTED
}
