package com.lendingmarket.backend.global.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Business limits for loans and repayments, bound from {@code lending.*}.
 */
@ConfigurationProperties(prefix = "lending")
public record LendingProperties(
        @DefaultValue Loan loan,
        @DefaultValue Repayment repayment
) {

    public record Loan(
            @DefaultValue("1") BigDecimal minPrincipal,
            @DefaultValue("1000000") BigDecimal maxPrincipal,
            @DefaultValue("0.1") BigDecimal minInterestRate,
            @DefaultValue("50") BigDecimal maxInterestRate,
            @DefaultValue("10") int minDescriptionLength
    ) {
    }

    public record Repayment(
            @DefaultValue("false") boolean allowOverpayment,
            @DefaultValue("10") int minRejectionReasonLength
    ) {
    }

    public static LendingProperties defaults() {
        return new LendingProperties(
                new Loan(BigDecimal.ONE, new BigDecimal("1000000"), new BigDecimal("0.1"), new BigDecimal("50"), 10),
                new Repayment(false, 10)
        );
    }
}
