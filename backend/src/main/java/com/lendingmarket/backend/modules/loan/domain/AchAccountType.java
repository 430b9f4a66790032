package com.lendingmarket.backend.modules.loan.domain;

import java.util.Locale;

public enum AchAccountType {
    CHECKING,
    SAVINGS;

    public static AchAccountType from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("account type is required");
        }
        return AchAccountType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
