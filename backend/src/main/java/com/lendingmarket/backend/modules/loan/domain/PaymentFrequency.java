package com.lendingmarket.backend.modules.loan.domain;

import java.time.LocalDate;

/**
 * Repayment cadence. Each value knows how many periods fit in a year and how to step a date forward.
 */
public enum PaymentFrequency {
    WEEKLY(52),
    BI_WEEKLY(26),
    MONTHLY(12),
    QUARTERLY(4),
    ANNUALLY(1);

    private final int periodsPerYear;

    PaymentFrequency(int periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    public int periodsPerYear() {
        return periodsPerYear;
    }

    public LocalDate advance(LocalDate date, int periods) {
        return switch (this) {
            case WEEKLY -> date.plusWeeks(periods);
            case BI_WEEKLY -> date.plusWeeks(2L * periods);
            case MONTHLY -> date.plusMonths(periods);
            case QUARTERLY -> date.plusMonths(3L * periods);
            case ANNUALLY -> date.plusYears(periods);
        };
    }
}
