package com.flagship.wallet_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for the append-only transaction log.
 * Used for inserts and reads only; records are never updated.
 */
@Repository
public interface TransactionRecordRepository extends JpaRepository<TransactionRecordEntity, Long> {

    /**
     * Newest first; ties on created_at are broken by insertion order.
     */
    List<TransactionRecordEntity> findByWalletIdOrderByCreatedAtDescIdDesc(UUID walletId);

    List<TransactionRecordEntity> findByReferenceOrderByIdAsc(String reference);
}
