package com.flagship.wallet_ledger.wallet;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent store of wallets, one row per user.
 *
 * Plain JDBC so that row locking and get-or-create are explicit SQL rather than
 * ORM side effects. Methods join whatever transaction is active on the calling
 * thread; {@link #lockForUpdate(UUID)} is only meaningful inside one.
 *
 * The only balance write, {@link #updateBalance(UUID, BigDecimal)}, is package
 * private and reserved for {@link BalanceAdjuster}.
 */
@Component
public class WalletStore {

    private static final String WALLET_COLUMNS = "id, user_id, balance, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final Duration lockTimeout;

    public WalletStore(JdbcTemplate jdbcTemplate,
                       @Value("${wallet.lock-timeout:5s}") Duration lockTimeout) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Returns the user's wallet, creating an empty one if none exists.
     *
     * Concurrent first access by the same user is resolved by the unique
     * constraint on user_id: the losing insert does nothing and both callers
     * read back the same row. Waiting on a concurrent uncommitted insert is
     * bounded by the lock timeout, like any other row lock.
     */
    public Wallet getOrCreate(UUID userId) {
        applyLockTimeout();
        jdbcTemplate.update(
            "INSERT INTO wallets (id, user_id, balance, created_at, updated_at) " +
            "VALUES (?, ?, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (user_id) DO NOTHING",
            UUID.randomUUID(),
            userId
        );
        return findByUserId(userId)
            .orElseThrow(() -> new IllegalStateException("Wallet missing after get-or-create for user " + userId));
    }

    /**
     * Unlocked read. Callers must not compute a new balance from this value.
     */
    public Optional<Wallet> findByUserId(UUID userId) {
        List<Wallet> rows = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE user_id = ?",
            walletRowMapper(),
            userId
        );
        return rows.stream().findFirst();
    }

    /**
     * Reads the wallet row under a row-level write lock held until the current
     * transaction ends. Waits at most the configured lock timeout.
     */
    public Wallet lockForUpdate(UUID walletId) {
        applyLockTimeout();
        List<Wallet> rows = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE id = ? FOR UPDATE",
            walletRowMapper(),
            walletId
        );
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Wallet not found: " + walletId);
        }
        return rows.get(0);
    }

    void updateBalance(UUID walletId, BigDecimal newBalance) {
        int updated = jdbcTemplate.update(
            "UPDATE wallets SET balance = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            newBalance,
            walletId
        );
        if (updated != 1) {
            throw new IllegalStateException("Balance update touched " + updated + " rows for wallet " + walletId);
        }
    }

    // Transaction-scoped; outside a transaction PostgreSQL ignores it with a warning.
    private void applyLockTimeout() {
        jdbcTemplate.execute("SET LOCAL lock_timeout = " + lockTimeout.toMillis());
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getBigDecimal("balance"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
