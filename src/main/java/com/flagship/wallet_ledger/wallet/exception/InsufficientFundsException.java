package com.flagship.wallet_ledger.wallet.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A debiting operation found the wallet balance below the requested amount.
 *
 * This is a business-rule rejection, not a system fault. It is always thrown
 * before any balance or log mutation of the failing operation is applied.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final UUID userId;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientFundsException(UUID userId, BigDecimal requested, BigDecimal available) {
        super(String.format("Insufficient wallet balance for user %s: requested=%s, available=%s",
                userId, requested, available));
        this.userId = userId;
        this.requested = requested;
        this.available = available;
    }
}
