package com.example.clinic.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers. Every amount leaving the engine has scale 2, so equal statements compare
 * equal field for field.
 */
final class Amounts {

    static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);

    private Amounts() {
    }

    static BigDecimal of(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal floorAtZero(BigDecimal amount) {
        return amount.signum() < 0 ? ZERO : of(amount);
    }

    static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }
}
