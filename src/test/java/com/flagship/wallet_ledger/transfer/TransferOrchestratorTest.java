package com.flagship.wallet_ledger.transfer;

import com.flagship.wallet_ledger.ledger.TransactionLog;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.ledger.TransactionType;
import com.flagship.wallet_ledger.wallet.BalanceAdjuster;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletStore;
import com.flagship.wallet_ledger.wallet.exception.InsufficientFundsException;
import com.flagship.wallet_ledger.wallet.exception.InvariantViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Orchestration rules checked against mocked storage:
 * - funds are checked before anything is written
 * - wallets are locked in wallet-id order
 * - every adjustment must be explained by its record
 */
class TransferOrchestratorTest {

    private static final UUID OWNER_USER = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID AGENT_USER = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    // Owner's wallet id sorts after the agent's, so lock order differs from argument order
    private static final UUID OWNER_WALLET = UUID.fromString("00000000-0000-0000-0000-000000000002");
    private static final UUID AGENT_WALLET = UUID.fromString("00000000-0000-0000-0000-000000000001");

    private WalletStore walletStore;
    private BalanceAdjuster balanceAdjuster;
    private TransactionLog transactionLog;
    private TransferOrchestrator orchestrator;

    private final AtomicLong recordIds = new AtomicLong();

    @BeforeEach
    void setUp() {
        walletStore = mock(WalletStore.class);
        balanceAdjuster = mock(BalanceAdjuster.class);
        transactionLog = mock(TransactionLog.class);
        orchestrator = new TransferOrchestrator(walletStore, balanceAdjuster, transactionLog, new BigDecimal("10"));

        when(transactionLog.append(any(), any(), any(), any())).thenAnswer(invocation -> {
            Wallet wallet = invocation.getArgument(0);
            return new TransactionRecord(recordIds.incrementAndGet(), wallet.getId(),
                invocation.getArgument(1), invocation.getArgument(2), invocation.getArgument(3), Instant.now());
        });
    }

    @Test
    @DisplayName("Configured delivery fee is normalized and must be positive")
    void testDefaultDeliveryFee() {
        assertEquals(new BigDecimal("10.00"), orchestrator.getDefaultDeliveryFee());
        assertThrows(IllegalArgumentException.class,
            () -> new TransferOrchestrator(walletStore, balanceAdjuster, transactionLog, BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Deposit credits the wallet and records a deposit")
    void testDeposit() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "0.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(wallet);
        when(balanceAdjuster.adjust(wallet, new BigDecimal("25.00"))).thenReturn(new BigDecimal("25.00"));

        BigDecimal balance = orchestrator.deposit(OWNER_USER, new BigDecimal("25.00"), "Added to Wallet");

        assertEquals(new BigDecimal("25.00"), balance);
        verify(transactionLog).append(wallet, TransactionType.DEPOSIT, new BigDecimal("25.00"), "Added to Wallet");
    }

    @Test
    @DisplayName("Insufficient funds rejects the debit before any write")
    void testDebitInsufficientFundsWritesNothing() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "50.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(wallet);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(wallet);

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> orchestrator.debitForOrder(OWNER_USER, new BigDecimal("100.00"), "ORDER:1"));

        assertEquals(new BigDecimal("100.00"), e.getRequested());
        assertEquals(new BigDecimal("50.00"), e.getAvailable());
        verifyNoInteractions(balanceAdjuster, transactionLog);
    }

    @Test
    @DisplayName("Order recorder runs after the funds check and supplies the reference")
    void testDebitWithOrderRecorder() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "80.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(wallet);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(wallet);
        when(balanceAdjuster.adjust(wallet, new BigDecimal("-30.00"))).thenReturn(new BigDecimal("50.00"));

        BigDecimal balance = orchestrator.debitForOrder(OWNER_USER, new BigDecimal("30.00"), () -> 42L);

        assertEquals(new BigDecimal("50.00"), balance);
        verify(transactionLog).append(wallet, TransactionType.DEBIT, new BigDecimal("30.00"), "ORDER:42");
    }

    @Test
    @DisplayName("Order recorder is never invoked for a customer who cannot pay")
    void testOrderRecorderSkippedOnInsufficientFunds() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "10.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(wallet);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(wallet);
        AtomicBoolean recorded = new AtomicBoolean();

        assertThrows(InsufficientFundsException.class,
            () -> orchestrator.debitForOrder(OWNER_USER, new BigDecimal("30.00"), () -> {
                recorded.set(true);
                return 1L;
            }));

        assertFalse(recorded.get());
    }

    @Test
    @DisplayName("Withdraw records a withdraw entry against the locked wallet")
    void testWithdraw() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "40.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(wallet);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(wallet);
        when(balanceAdjuster.adjust(wallet, new BigDecimal("-40.00"))).thenReturn(new BigDecimal("0.00"));

        BigDecimal balance = orchestrator.withdraw(OWNER_USER, new BigDecimal("40.00"), "Withdrawn to Bank");

        assertEquals(new BigDecimal("0.00"), balance);
        verify(transactionLog).append(wallet, TransactionType.WITHDRAW, new BigDecimal("40.00"), "Withdrawn to Bank");
    }

    @Test
    @DisplayName("Delivery fee split locks wallets in ascending wallet-id order")
    void testDeliveryFeeLockOrder() {
        Wallet owner = wallet(OWNER_WALLET, OWNER_USER, "100.00");
        Wallet agent = wallet(AGENT_WALLET, AGENT_USER, "0.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(owner);
        when(walletStore.getOrCreate(AGENT_USER)).thenReturn(agent);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(owner);
        when(walletStore.lockForUpdate(AGENT_WALLET)).thenReturn(agent);
        when(balanceAdjuster.adjust(owner, new BigDecimal("-50.00"))).thenReturn(new BigDecimal("50.00"));
        when(balanceAdjuster.adjust(agent, new BigDecimal("50.00"))).thenReturn(new BigDecimal("50.00"));

        DeliveryFeeTransfer result = orchestrator.transferDeliveryFee(
            OWNER_USER, AGENT_USER, new BigDecimal("50.00"), "DELIVERY:9");

        assertEquals(new BigDecimal("50.00"), result.getOwnerBalance());
        assertEquals(new BigDecimal("50.00"), result.getAgentBalance());
        assertEquals("DELIVERY:9", result.getReference());

        InOrder order = inOrder(walletStore, balanceAdjuster, transactionLog);
        order.verify(walletStore).lockForUpdate(AGENT_WALLET);
        order.verify(walletStore).lockForUpdate(OWNER_WALLET);
        order.verify(balanceAdjuster).adjust(owner, new BigDecimal("-50.00"));
        order.verify(transactionLog).append(owner, TransactionType.DEBIT_FOR_DELIVERY, new BigDecimal("50.00"), "DELIVERY:9");
        order.verify(balanceAdjuster).adjust(agent, new BigDecimal("50.00"));
        order.verify(transactionLog).append(agent, TransactionType.DELIVERY_EARNING, new BigDecimal("50.00"), "DELIVERY:9");
    }

    @Test
    @DisplayName("Owner who cannot cover the fee leaves the agent untouched")
    void testDeliveryFeeInsufficientFunds() {
        Wallet owner = wallet(OWNER_WALLET, OWNER_USER, "5.00");
        Wallet agent = wallet(AGENT_WALLET, AGENT_USER, "0.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(owner);
        when(walletStore.getOrCreate(AGENT_USER)).thenReturn(agent);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(owner);
        when(walletStore.lockForUpdate(AGENT_WALLET)).thenReturn(agent);

        assertThrows(InsufficientFundsException.class, () -> orchestrator.transferDeliveryFee(
            OWNER_USER, AGENT_USER, new BigDecimal("10.00"), "DELIVERY:3"));

        verifyNoInteractions(balanceAdjuster, transactionLog);
    }

    @Test
    @DisplayName("Delivery fee without an explicit amount uses the configured fee")
    void testDeliveryFeeDefault() {
        Wallet owner = wallet(OWNER_WALLET, OWNER_USER, "100.00");
        Wallet agent = wallet(AGENT_WALLET, AGENT_USER, "0.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(owner);
        when(walletStore.getOrCreate(AGENT_USER)).thenReturn(agent);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(owner);
        when(walletStore.lockForUpdate(AGENT_WALLET)).thenReturn(agent);
        when(balanceAdjuster.adjust(any(), any())).thenReturn(BigDecimal.ONE);

        DeliveryFeeTransfer result = orchestrator.transferDeliveryFee(OWNER_USER, AGENT_USER, "DELIVERY:4");

        assertEquals(new BigDecimal("10.00"), result.getFee());
        verify(balanceAdjuster).adjust(owner, new BigDecimal("-10.00"));
        verify(balanceAdjuster).adjust(agent, new BigDecimal("10.00"));
    }

    @Test
    @DisplayName("Owner and agent must be different users")
    void testDeliveryFeeSameUserRejected() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator.transferDeliveryFee(
            OWNER_USER, OWNER_USER, new BigDecimal("10.00"), "DELIVERY:5"));
        verifyNoInteractions(walletStore, balanceAdjuster, transactionLog);
    }

    @Test
    @DisplayName("A record that does not explain its adjustment aborts the operation")
    void testMismatchedRecordIsInvariantViolation() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "0.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(wallet);
        when(balanceAdjuster.adjust(wallet, new BigDecimal("20.00"))).thenReturn(new BigDecimal("20.00"));
        // record explains +2.00 while the balance moved by +20.00
        doReturn(new TransactionRecord(99L, OWNER_WALLET, TransactionType.CREDIT_FOR_GOODS,
                new BigDecimal("2.00"), "ORDER:8", Instant.now()))
            .when(transactionLog).append(eq(wallet), eq(TransactionType.CREDIT_FOR_GOODS), any(), any());

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> orchestrator.creditOwnerForOrder(OWNER_USER, new BigDecimal("20.00"), "ORDER:8"));

        assertTrue(e.getMessage().contains("does not match balance delta"));
        verify(transactionLog).append(wallet, TransactionType.CREDIT_FOR_GOODS, new BigDecimal("20.00"), "ORDER:8");
    }

    @Test
    @DisplayName("A record for the wrong wallet in a fee split aborts the operation")
    void testMisdirectedRecordIsInvariantViolation() {
        Wallet owner = wallet(OWNER_WALLET, OWNER_USER, "100.00");
        Wallet agent = wallet(AGENT_WALLET, AGENT_USER, "0.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(owner);
        when(walletStore.getOrCreate(AGENT_USER)).thenReturn(agent);
        when(walletStore.lockForUpdate(OWNER_WALLET)).thenReturn(owner);
        when(walletStore.lockForUpdate(AGENT_WALLET)).thenReturn(agent);
        when(balanceAdjuster.adjust(any(), any())).thenReturn(BigDecimal.ONE);
        // agent earning recorded against the owner's wallet
        doReturn(new TransactionRecord(100L, OWNER_WALLET, TransactionType.DELIVERY_EARNING,
                new BigDecimal("10.00"), "DELIVERY:6", Instant.now()))
            .when(transactionLog).append(eq(agent), eq(TransactionType.DELIVERY_EARNING), any(), any());

        assertThrows(InvariantViolationException.class, () -> orchestrator.transferDeliveryFee(
            OWNER_USER, AGENT_USER, new BigDecimal("10.00"), "DELIVERY:6"));
    }

    @Test
    @DisplayName("Wallet snapshot of an unknown user is empty and creates nothing")
    void testReadWalletUnknownUser() {
        when(walletStore.findByUserId(OWNER_USER)).thenReturn(Optional.empty());

        WalletSnapshot snapshot = orchestrator.readWallet(OWNER_USER);

        assertEquals(new BigDecimal("0.00"), snapshot.getBalance());
        assertNull(snapshot.getUpdatedAt());
        assertTrue(snapshot.getTransactions().isEmpty());
        verify(walletStore, never()).getOrCreate(any());
        verifyNoInteractions(transactionLog);
    }

    @Test
    @DisplayName("Wallet snapshot pairs the balance with the wallet's history")
    void testReadWallet() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "25.00");
        TransactionRecord deposit = new TransactionRecord(1L, OWNER_WALLET, TransactionType.DEPOSIT,
            new BigDecimal("25.00"), "Added to Wallet", Instant.now());
        when(walletStore.findByUserId(OWNER_USER)).thenReturn(Optional.of(wallet));
        when(transactionLog.list(OWNER_WALLET)).thenReturn(List.of(deposit));

        WalletSnapshot snapshot = orchestrator.readWallet(OWNER_USER);

        assertEquals(new BigDecimal("25.00"), snapshot.getBalance());
        assertEquals(wallet.getUpdatedAt(), snapshot.getUpdatedAt());
        assertEquals(List.of(deposit), snapshot.getTransactions());
    }

    @Test
    @DisplayName("Credits never check funds")
    void testCreditSkipsLock() {
        Wallet wallet = wallet(OWNER_WALLET, OWNER_USER, "0.00");
        when(walletStore.getOrCreate(OWNER_USER)).thenReturn(wallet);
        when(balanceAdjuster.adjust(wallet, new BigDecimal("20.00"))).thenReturn(new BigDecimal("20.00"));

        orchestrator.creditOwnerForOrder(OWNER_USER, new BigDecimal("20.00"), "ORDER:8");

        verify(walletStore, never()).lockForUpdate(any());
        verify(transactionLog).append(wallet, TransactionType.CREDIT_FOR_GOODS, new BigDecimal("20.00"), "ORDER:8");
    }

    private static Wallet wallet(UUID id, UUID userId, String balance) {
        return new Wallet(id, userId, new BigDecimal(balance), Instant.now(), Instant.now());
    }
}
