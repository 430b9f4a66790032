package com.lendingmarket.backend.modules.loan.domain;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Payment arithmetic for a loan's repayment terms. Amounts are rounded half-up to cents.
 */
public final class LoanTermsCalculator {

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    private LoanTermsCalculator() {
    }

    /**
     * Rounded half-even, so a 3 month bi-weekly loan has 6 payments. May be zero for very short terms.
     */
    public static int totalPayments(PaymentFrequency frequency, int termLengthMonths) {
        BigDecimal periods = BigDecimal.valueOf((long) frequency.periodsPerYear() * termLengthMonths)
                .divide(TWELVE, 0, RoundingMode.HALF_EVEN);
        return periods.intValueExact();
    }

    public static LocalDate maturityDate(LocalDate startDate, int termLengthMonths) {
        return startDate.plusMonths(termLengthMonths);
    }

    /**
     * Level payment {@code P·r(1+r)^n / ((1+r)^n - 1)} where {@code r} is the periodic rate.
     * A zero rate spreads the principal evenly.
     */
    public static BigDecimal periodicPayment(BigDecimal principal, BigDecimal annualRatePercent,
                                             PaymentFrequency frequency, int numberOfPayments) {
        if (numberOfPayments <= 0) {
            throw new IllegalArgumentException("numberOfPayments must be positive");
        }
        if (principal.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        BigDecimal rate = annualRatePercent
                .divide(HUNDRED, MC)
                .divide(BigDecimal.valueOf(frequency.periodsPerYear()), MC);
        if (rate.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(numberOfPayments), 2, RoundingMode.HALF_UP);
        }
        BigDecimal growth = BigDecimal.ONE.add(rate, MC).pow(numberOfPayments, MC);
        BigDecimal numerator = principal.multiply(rate, MC).multiply(growth, MC);
        BigDecimal denominator = growth.subtract(BigDecimal.ONE, MC);
        return numerator.divide(denominator, 2, RoundingMode.HALF_UP);
    }

    public static BigDecimal totalRepayable(BigDecimal periodicPayment, int numberOfPayments) {
        return periodicPayment.multiply(BigDecimal.valueOf(numberOfPayments)).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Due dates of every payment; the first is due on the start date.
     */
    public static List<LocalDate> paymentSchedule(LocalDate startDate, PaymentFrequency frequency, int numberOfPayments) {
        List<LocalDate> dates = new ArrayList<>(numberOfPayments);
        for (int i = 0; i < numberOfPayments; i++) {
            dates.add(frequency.advance(startDate, i));
        }
        return dates;
    }

    /**
     * Per-period interest/principal split for one lender's contribution. The last row absorbs rounding
     * so the balance closes at exactly zero.
     */
    public static List<AmortizationEntry> amortizationSchedule(BigDecimal contribution, BigDecimal annualRatePercent,
                                                               PaymentFrequency frequency, LocalDate startDate,
                                                               int numberOfPayments) {
        BigDecimal payment = periodicPayment(contribution, annualRatePercent, frequency, numberOfPayments);
        BigDecimal rate = annualRatePercent
                .divide(HUNDRED, MC)
                .divide(BigDecimal.valueOf(frequency.periodsPerYear()), MC);
        List<LocalDate> dates = paymentSchedule(startDate, frequency, numberOfPayments);

        List<AmortizationEntry> entries = new ArrayList<>(numberOfPayments);
        BigDecimal balance = contribution.setScale(2, RoundingMode.HALF_UP);
        for (int i = 0; i < numberOfPayments; i++) {
            BigDecimal interest = balance.multiply(rate, MC).setScale(2, RoundingMode.HALF_UP);
            boolean last = i == numberOfPayments - 1;
            BigDecimal principalPart = last ? balance : payment.subtract(interest).min(balance);
            BigDecimal amount = principalPart.add(interest);
            balance = balance.subtract(principalPart);
            entries.add(new AmortizationEntry(i + 1, dates.get(i), amount, interest, principalPart, balance));
        }
        return entries;
    }

    public record AmortizationEntry(
            int paymentNumber,
            LocalDate dueDate,
            BigDecimal paymentAmount,
            BigDecimal interest,
            BigDecimal principal,
            BigDecimal remainingBalance
    ) {
    }
}
