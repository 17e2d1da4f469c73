package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.ledger.TransactionLog;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.observability.CorrelationContext;
import com.flagship.wallet_ledger.observability.WalletMetrics;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletStore;
import com.flagship.wallet_ledger.wallet.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.wallet.exception.InvariantViolationException;
import com.flagship.wallet_ledger.wallet.exception.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionSystemException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point of the wallet ledger for the rest of the application.
 *
 * Validates amounts and references, then delegates to {@link TransferOrchestrator}.
 * Around every fund movement it:
 * - tags log lines with the user and operation (MDC)
 * - records outcome and latency metrics
 * - reports storage failures as retryable {@link StorageUnavailableException}
 *
 * Business rejections ({@link InsufficientFundsException}) pass through unchanged.
 * Nothing is retried here: retrying a money movement is the caller's decision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletLedgerService {

    private final TransferOrchestrator orchestrator;
    private final WalletStore walletStore;
    private final TransactionLog transactionLog;
    private final WalletMetrics walletMetrics;

    public BigDecimal deposit(UUID userId, BigDecimal amount, String reference) {
        Objects.requireNonNull(userId, "userId");
        BigDecimal checked = Amounts.requirePositive(amount, "amount");
        String ref = References.orDefault(reference, References.DEPOSIT_DEFAULT);
        return execute("deposit", userId, () -> orchestrator.deposit(userId, checked, ref));
    }

    public BigDecimal withdraw(UUID userId, BigDecimal amount, String reference) {
        Objects.requireNonNull(userId, "userId");
        BigDecimal checked = Amounts.requirePositive(amount, "amount");
        String ref = References.orDefault(reference, References.WITHDRAW_DEFAULT);
        return execute("withdraw", userId, () -> orchestrator.withdraw(userId, checked, ref));
    }

    public BigDecimal debitForOrder(UUID customerId, BigDecimal amount, String orderReference) {
        Objects.requireNonNull(customerId, "customerId");
        BigDecimal checked = Amounts.requirePositive(amount, "amount");
        String ref = References.require(orderReference);
        return execute("debit_for_order", customerId, () -> orchestrator.debitForOrder(customerId, checked, ref));
    }

    /**
     * Charges the customer and creates the order through {@code orderRecorder}
     * in one transaction. See {@link TransferOrchestrator#debitForOrder(UUID, BigDecimal, OrderRecorder)}.
     */
    public BigDecimal debitForOrder(UUID customerId, BigDecimal amount, OrderRecorder orderRecorder) {
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(orderRecorder, "orderRecorder");
        BigDecimal checked = Amounts.requirePositive(amount, "amount");
        return execute("debit_for_order", customerId,
            () -> orchestrator.debitForOrder(customerId, checked, orderRecorder));
    }

    public BigDecimal creditOwnerForOrder(UUID ownerId, BigDecimal amount, String orderReference) {
        Objects.requireNonNull(ownerId, "ownerId");
        BigDecimal checked = Amounts.requirePositive(amount, "amount");
        String ref = References.require(orderReference);
        return execute("credit_owner_for_order", ownerId,
            () -> orchestrator.creditOwnerForOrder(ownerId, checked, ref));
    }

    public DeliveryFeeTransfer transferDeliveryFee(UUID ownerId, UUID agentId, BigDecimal fee,
                                                   String deliveryReference) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(agentId, "agentId");
        BigDecimal checked = Amounts.requirePositive(fee, "fee");
        String ref = References.require(deliveryReference);
        return execute("transfer_delivery_fee", ownerId,
            () -> orchestrator.transferDeliveryFee(ownerId, agentId, checked, ref));
    }

    /**
     * Fee split using the configured default delivery fee.
     */
    public DeliveryFeeTransfer transferDeliveryFee(UUID ownerId, UUID agentId, String deliveryReference) {
        return transferDeliveryFee(ownerId, agentId, orchestrator.getDefaultDeliveryFee(), deliveryReference);
    }

    /**
     * Current balance; zero for a user who has no wallet yet. Never creates a wallet.
     */
    public BigDecimal getBalance(UUID userId) {
        return query("get_balance", () -> walletStore.findByUserId(userId)
            .map(Wallet::getBalance)
            .orElse(BigDecimal.ZERO.setScale(Amounts.SCALE)));
    }

    public Optional<Wallet> getWallet(UUID userId) {
        return query("get_wallet", () -> walletStore.findByUserId(userId));
    }

    /**
     * Transaction history, newest first. Side-effect free; every call reflects
     * the current persisted state.
     */
    public List<TransactionRecord> listTransactions(UUID userId) {
        return query("list_transactions", () -> walletStore.findByUserId(userId)
            .map(wallet -> transactionLog.list(wallet.getId()))
            .orElse(List.of()));
    }

    /**
     * Balance, last update and history taken from one consistent read.
     */
    public WalletSnapshot getWalletSnapshot(UUID userId) {
        return query("get_wallet_snapshot", () -> orchestrator.readWallet(userId));
    }

    /**
     * All records carrying a business reference, oldest first. Callers check
     * this before re-issuing a movement whose outcome they did not observe.
     */
    public List<TransactionRecord> findTransactionsByReference(String reference) {
        return query("find_by_reference", () -> transactionLog.findByReference(References.require(reference)));
    }

    private <T> T execute(String operation, UUID userId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId.toString());
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation);

        try {
            T result = action.get();

            long duration = System.currentTimeMillis() - startTime;
            walletMetrics.recordOperation(operation, WalletMetrics.OUTCOME_SUCCESS);
            log.info("Wallet operation completed: result={}, duration={}ms", result, duration);
            return result;

        } catch (InsufficientFundsException e) {
            walletMetrics.recordOperation(operation, WalletMetrics.OUTCOME_INSUFFICIENT_FUNDS);
            walletMetrics.recordInsufficientFunds(operation);
            log.info("Wallet operation rejected: requested={}, available={}", e.getRequested(), e.getAvailable());
            throw e;

        } catch (InvariantViolationException e) {
            walletMetrics.recordOperation(operation, WalletMetrics.OUTCOME_INVARIANT_VIOLATION);
            log.error("Ledger invariant violated, operation rolled back: {}", e.getMessage());
            throw e;

        } catch (IllegalArgumentException e) {
            walletMetrics.recordOperation(operation, WalletMetrics.OUTCOME_REJECTED);
            log.warn("Wallet operation rejected: {}", e.getMessage());
            throw e;

        } catch (RuntimeException e) {
            if (isStorageFailure(e)) {
                walletMetrics.recordOperation(operation, WalletMetrics.OUTCOME_STORAGE_UNAVAILABLE);
                log.warn("Wallet storage unavailable, nothing applied: {}", e.getMessage());
                throw new StorageUnavailableException("Wallet storage unavailable during " + operation, e);
            }
            walletMetrics.recordOperation(operation, WalletMetrics.OUTCOME_ERROR);
            log.error("Wallet operation failed: error={}", e.getMessage());
            throw e;

        } finally {
            walletMetrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
        }
    }

    private <T> T query(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            if (isStorageFailure(e)) {
                throw new StorageUnavailableException("Wallet storage unavailable during " + operation, e);
            }
            throw e;
        }
    }

    /**
     * Lock timeouts, deadlocks, lost connections and failed begin/commit: the
     * transaction did not commit, so the whole operation can be retried.
     */
    static boolean isStorageFailure(RuntimeException e) {
        return e instanceof TransientDataAccessException
            || e instanceof DataAccessResourceFailureException
            || e instanceof CannotCreateTransactionException
            || e instanceof TransactionSystemException;
    }
}
