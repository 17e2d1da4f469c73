package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.wallet.Wallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit trail of wallet balance changes.
 *
 * Appends must happen in the same transaction as the balance adjustment they
 * explain, so a failed append takes the adjustment down with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLog {

    private final TransactionRecordRepository repository;

    /**
     * Persists one immutable record.
     *
     * @param wallet wallet whose balance change this record explains
     * @param type semantic tag, which also fixes the sign
     * @param amount positive magnitude
     * @param reference correlation to the originating business event
     * @return the persisted record, with its assigned id
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransactionRecord append(Wallet wallet, TransactionType type, BigDecimal amount, String reference) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transaction amount must be positive: " + amount);
        }
        TransactionRecordEntity saved = repository.save(
            TransactionRecordEntity.of(wallet.getId(), type, amount, reference));
        log.debug("Appended {} {} to wallet {} (ref={})", type.getTag(), amount, wallet.getId(), reference);
        return saved.toDomain();
    }

    /**
     * Records of a wallet, newest first. Re-reads the store on every call.
     */
    @Transactional(readOnly = true)
    public List<TransactionRecord> list(UUID walletId) {
        return repository.findByWalletIdOrderByCreatedAtDescIdDesc(walletId).stream()
            .map(TransactionRecordEntity::toDomain)
            .toList();
    }

    /**
     * All records sharing a reference, in insertion order.
     */
    @Transactional(readOnly = true)
    public List<TransactionRecord> findByReference(String reference) {
        return repository.findByReferenceOrderByIdAsc(reference).stream()
            .map(TransactionRecordEntity::toDomain)
            .toList();
    }
}
