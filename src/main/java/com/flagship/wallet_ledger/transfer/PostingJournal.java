package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.wallet.exception.InvariantViolationException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Tracks the balance adjustments and log appends of one orchestrated operation.
 *
 * Adjustments and appends are paired by position. {@link #verify()} fails if a
 * pair is missing or if the persisted record does not explain its adjustment
 * (other wallet, other signed amount, or no id assigned).
 */
final class PostingJournal {

    private final List<Adjustment> adjustments = new ArrayList<>();
    private final List<TransactionRecord> records = new ArrayList<>();

    void adjusted(UUID walletId, BigDecimal delta) {
        adjustments.add(new Adjustment(walletId, delta));
    }

    void appended(TransactionRecord record) {
        records.add(record);
    }

    void verify() {
        if (adjustments.size() != records.size()) {
            throw new InvariantViolationException(String.format(
                "Posting mismatch: %d balance adjustments but %d transaction records",
                adjustments.size(), records.size()));
        }
        for (int i = 0; i < adjustments.size(); i++) {
            Adjustment adjustment = adjustments.get(i);
            TransactionRecord record = records.get(i);

            if (record == null || record.getId() == null) {
                throw new InvariantViolationException(
                    "Transaction record for wallet " + adjustment.getWalletId() + " was not persisted");
            }
            if (!adjustment.getWalletId().equals(record.getWalletId())) {
                throw new InvariantViolationException(String.format(
                    "Record %d belongs to wallet %s but explains an adjustment of wallet %s",
                    record.getId(), record.getWalletId(), adjustment.getWalletId()));
            }
            if (adjustment.getDelta().compareTo(record.signedAmount()) != 0) {
                throw new InvariantViolationException(String.format(
                    "Record %d (%s %s) does not match balance delta %s on wallet %s",
                    record.getId(), record.getType().getTag(), record.getAmount(),
                    adjustment.getDelta(), adjustment.getWalletId()));
            }
        }
    }

    @Value
    private static class Adjustment {
        UUID walletId;
        BigDecimal delta;
    }
}
