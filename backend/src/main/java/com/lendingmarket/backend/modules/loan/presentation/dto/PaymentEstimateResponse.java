package com.lendingmarket.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;

public record PaymentEstimateResponse(
        BigDecimal paymentAmount,
        int numberOfPayments,
        BigDecimal totalRepayment,
        BigDecimal totalInterest
) {
}
