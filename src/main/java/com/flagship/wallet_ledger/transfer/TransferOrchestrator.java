package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.ledger.TransactionLog;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.wallet.BalanceAdjuster;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletStore;
import com.flagship.wallet_ledger.wallet.exception.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Composes balance adjustments and log appends into named, atomic fund movements.
 *
 * This service enforces the core invariants:
 * 1. Every balance adjustment is paired with exactly one transaction record
 * 2. A debit never drives a balance negative; the check runs under the row lock
 * 3. All adjustments of one operation commit together or not at all
 *
 * Operations use REQUIRED propagation: they start a transaction or join the
 * caller's, so a caller creating an order can make the debit part of its own
 * unit of work. Wallets touched together are locked in ascending wallet-id
 * order, whatever the direction of the money, so overlapping transfers cannot
 * deadlock.
 *
 * Amounts and references are expected to be validated by the caller
 * ({@link WalletLedgerService}).
 */
@Service
@Slf4j
public class TransferOrchestrator {

    private final WalletStore walletStore;
    private final BalanceAdjuster balanceAdjuster;
    private final TransactionLog transactionLog;
    private final BigDecimal defaultDeliveryFee;

    public TransferOrchestrator(WalletStore walletStore,
                                BalanceAdjuster balanceAdjuster,
                                TransactionLog transactionLog,
                                @Value("${wallet.delivery-fee:10.00}") BigDecimal defaultDeliveryFee) {
        this.walletStore = walletStore;
        this.balanceAdjuster = balanceAdjuster;
        this.transactionLog = transactionLog;
        this.defaultDeliveryFee = Amounts.requirePositive(defaultDeliveryFee, "wallet.delivery-fee");
    }

    public BigDecimal getDefaultDeliveryFee() {
        return defaultDeliveryFee;
    }

    /**
     * Adds externally sourced funds to a wallet. Never fails for lack of funds.
     */
    @Transactional
    public BigDecimal deposit(UUID userId, BigDecimal amount, String reference) {
        Wallet wallet = walletStore.getOrCreate(userId);
        PostingJournal journal = new PostingJournal();
        BigDecimal balance = post(wallet, TransactionType.DEPOSIT, amount, reference, journal);
        journal.verify();
        return balance;
    }

    /**
     * Charges a customer for an order that already has a reference.
     *
     * @throws InsufficientFundsException if the balance is below the price; nothing is written
     */
    @Transactional
    public BigDecimal debitForOrder(UUID customerId, BigDecimal price, String orderReference) {
        return debitChecked(customerId, TransactionType.DEBIT, price, () -> orderReference);
    }

    /**
     * Charges a customer and creates the order in the same transaction.
     *
     * The recorder runs after the funds check, so no order is created for a
     * customer who cannot pay. If the recorder throws, the debit is rolled back.
     */
    @Transactional
    public BigDecimal debitForOrder(UUID customerId, BigDecimal price, OrderRecorder orderRecorder) {
        return debitChecked(customerId, TransactionType.DEBIT, price,
            () -> References.require(References.order(orderRecorder.recordOrder())));
    }

    /**
     * Pays the owner for fulfilled goods. Credits cannot fail for lack of funds.
     */
    @Transactional
    public BigDecimal creditOwnerForOrder(UUID ownerId, BigDecimal price, String orderReference) {
        Wallet wallet = walletStore.getOrCreate(ownerId);
        PostingJournal journal = new PostingJournal();
        BigDecimal balance = post(wallet, TransactionType.CREDIT_FOR_GOODS, price, orderReference, journal);
        journal.verify();
        return balance;
    }

    /**
     * Moves funds from a wallet out to the user's bank.
     *
     * @throws InsufficientFundsException if the balance is below the amount; nothing is written
     */
    @Transactional
    public BigDecimal withdraw(UUID userId, BigDecimal amount, String reference) {
        return debitChecked(userId, TransactionType.WITHDRAW, amount, () -> reference);
    }

    /**
     * Splits the configured delivery fee from owner to agent.
     */
    @Transactional
    public DeliveryFeeTransfer transferDeliveryFee(UUID ownerId, UUID agentId, String deliveryReference) {
        return transferDeliveryFee(ownerId, agentId, defaultDeliveryFee, deliveryReference);
    }

    /**
     * Debits the owner and credits the delivery agent by the same fee.
     *
     * Both sides commit together: a failure anywhere, including after the owner
     * side has been applied, rolls back both wallets and both records.
     *
     * @throws InsufficientFundsException if the owner cannot cover the fee; nothing is written
     */
    @Transactional
    public DeliveryFeeTransfer transferDeliveryFee(UUID ownerId, UUID agentId, BigDecimal fee,
                                                   String deliveryReference) {
        if (ownerId.equals(agentId)) {
            throw new IllegalArgumentException("Owner and delivery agent must be different users: " + ownerId);
        }

        Map<UUID, Wallet> wallets = getOrCreateAll(ownerId, agentId);
        Map<UUID, Wallet> locked = lockInOrder(wallets.get(ownerId), wallets.get(agentId));
        Wallet owner = locked.get(ownerId);
        Wallet agent = locked.get(agentId);

        requireFunds(owner, fee);

        PostingJournal journal = new PostingJournal();
        BigDecimal ownerBalance = post(owner, TransactionType.DEBIT_FOR_DELIVERY, fee, deliveryReference, journal);
        BigDecimal agentBalance = post(agent, TransactionType.DELIVERY_EARNING, fee, deliveryReference, journal);
        journal.verify();

        log.debug("Delivery fee {} moved from wallet {} to wallet {} (ref={})",
                fee, owner.getId(), agent.getId(), deliveryReference);
        return new DeliveryFeeTransfer(ownerBalance, agentBalance, fee, deliveryReference);
    }

    /**
     * Wallet and history in one repeatable-read transaction. Never creates a wallet.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public WalletSnapshot readWallet(UUID userId) {
        return walletStore.findByUserId(userId)
            .map(wallet -> new WalletSnapshot(wallet.getBalance(), wallet.getUpdatedAt(),
                transactionLog.list(wallet.getId())))
            .orElseGet(() -> new WalletSnapshot(BigDecimal.ZERO.setScale(Amounts.SCALE), null, List.of()));
    }

    private BigDecimal debitChecked(UUID userId, TransactionType type, BigDecimal amount,
                                    Supplier<String> reference) {
        Wallet wallet = walletStore.lockForUpdate(walletStore.getOrCreate(userId).getId());
        requireFunds(wallet, amount);

        PostingJournal journal = new PostingJournal();
        BigDecimal balance = post(wallet, type, amount, reference.get(), journal);
        journal.verify();
        return balance;
    }

    private BigDecimal post(Wallet wallet, TransactionType type, BigDecimal amount, String reference,
                            PostingJournal journal) {
        BigDecimal delta = type.signed(amount);
        BigDecimal newBalance = balanceAdjuster.adjust(wallet, delta);
        journal.adjusted(wallet.getId(), delta);

        TransactionRecord record = transactionLog.append(wallet, type, amount, reference);
        journal.appended(record);
        return newBalance;
    }

    private static void requireFunds(Wallet wallet, BigDecimal amount) {
        if (!wallet.canCover(amount)) {
            throw new InsufficientFundsException(wallet.getUserId(), amount, wallet.getBalance());
        }
    }

    // First-access inserts also take locks (on the unique user_id), so they follow a fixed order too.
    private Map<UUID, Wallet> getOrCreateAll(UUID... userIds) {
        Map<UUID, Wallet> byUser = new LinkedHashMap<>();
        Stream.of(userIds)
            .sorted()
            .forEach(userId -> byUser.put(userId, walletStore.getOrCreate(userId)));
        return byUser;
    }

    private Map<UUID, Wallet> lockInOrder(Wallet... wallets) {
        Map<UUID, Wallet> byUser = new LinkedHashMap<>();
        Stream.of(wallets)
            .sorted(Comparator.comparing(Wallet::getId))
            .forEach(wallet -> byUser.put(wallet.getUserId(), walletStore.lockForUpdate(wallet.getId())));
        return byUser;
    }
}
