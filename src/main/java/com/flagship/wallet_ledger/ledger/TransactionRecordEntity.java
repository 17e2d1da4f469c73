package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a wallet transaction record.
 *
 * No setters and every column is updatable = false: once inserted a record
 * can only be read. The database rejects UPDATE and DELETE as well.
 */
@Entity
@Table(
    name = "wallet_transactions",
    indexes = {
        @Index(name = "idx_wallet_transactions_wallet_created", columnList = "wallet_id, created_at, id"),
        @Index(name = "idx_wallet_transactions_reference", columnList = "reference")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "wallet_id", nullable = false, updatable = false)
    private UUID walletId;

    @Convert(converter = TransactionTypeConverter.class)
    @Column(name = "txn_type", nullable = false, updatable = false, length = 32)
    private TransactionType type;

    @Column(nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, length = 100)
    private String reference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private TransactionRecordEntity(UUID walletId, TransactionType type, BigDecimal amount, String reference) {
        this.walletId = walletId;
        this.type = type;
        this.amount = amount;
        this.reference = reference;
    }

    static TransactionRecordEntity of(UUID walletId, TransactionType type, BigDecimal amount, String reference) {
        return new TransactionRecordEntity(walletId, type, amount, reference != null ? reference : "");
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        throw new IllegalStateException("Transaction record " + id + " is immutable");
    }

    public TransactionRecord toDomain() {
        return new TransactionRecord(id, walletId, type, amount, reference, createdAt);
    }
}
