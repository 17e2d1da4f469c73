package com.flagship.wallet_ledger.transfer;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money amount checks shared by all orchestrated operations.
 * Amounts are positive with at most two fractional digits, matching NUMERIC(12,2).
 */
public final class Amounts {

    public static final int SCALE = 2;
    public static final int PRECISION = 12;

    private Amounts() {
    }

    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException(field + " must be positive: " + amount.toPlainString());
        }
        BigDecimal normalized;
        try {
            normalized = amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                field + " must have at most " + SCALE + " decimal places: " + amount.toPlainString(), e);
        }
        if (normalized.precision() > PRECISION) {
            throw new IllegalArgumentException(field + " is too large: " + amount.toPlainString());
        }
        return normalized;
    }
}
