package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable log entry explaining one balance change.
 *
 * Key invariant: for every wallet, the sum of {@link #signedAmount()} over its
 * records equals its current balance.
 */
@Value
public class TransactionRecord {
    Long id;
    UUID walletId;
    TransactionType type;
    BigDecimal amount;
    String reference;
    Instant createdAt;

    public BigDecimal signedAmount() {
        return type.signed(amount);
    }
}
