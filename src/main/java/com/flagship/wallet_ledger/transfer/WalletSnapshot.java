package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.ledger.TransactionRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Balance and history read from the same database snapshot, so the balance
 * always equals the sum of the listed records.
 */
@Value
public class WalletSnapshot {
    BigDecimal balance;
    Instant updatedAt;
    List<TransactionRecord> transactions;
}
