package com.lendingmarket.backend.modules.auth.domain;

/**
 * What a user may do. Every account is a BORROWER; LENDER is granted once the user is invited to fund a loan.
 */
public enum Capability {
    BORROWER,
    LENDER,
    ADMIN
}
