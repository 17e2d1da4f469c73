package com.flagship.wallet_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a user's wallet row.
 *
 * Instances are read-only views. The balance changes only through
 * {@link BalanceAdjuster}, never by building a new Wallet and saving it.
 */
@Value
public class Wallet {
    UUID id;
    UUID userId;
    BigDecimal balance;
    Instant createdAt;
    Instant updatedAt;

    public boolean canCover(BigDecimal amount) {
        return balance.compareTo(amount) >= 0;
    }
}
