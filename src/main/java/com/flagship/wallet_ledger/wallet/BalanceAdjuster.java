package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.wallet.exception.InsufficientFundsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * The single write path for wallet balances.
 *
 * Every adjustment re-reads the wallet under a row lock, so two concurrent
 * adjustments of the same wallet serialize instead of both computing from the
 * same stale balance. The adjuster does not write transaction records; pairing
 * each adjustment with its record is the orchestrator's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAdjuster {

    private final WalletStore walletStore;

    /**
     * Applies a signed delta to the wallet balance.
     *
     * Must run inside an existing transaction: the lock is released at commit,
     * so an adjustment outside a unit of work would protect nothing.
     *
     * @param wallet wallet to adjust (only its id is trusted, the balance is re-read)
     * @param delta positive to credit, negative to debit
     * @return the balance after the adjustment
     * @throws InsufficientFundsException if the result would be negative; nothing is written
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal adjust(Wallet wallet, BigDecimal delta) {
        Wallet locked = walletStore.lockForUpdate(wallet.getId());
        BigDecimal newBalance = locked.getBalance().add(delta);

        if (newBalance.signum() < 0) {
            throw new InsufficientFundsException(locked.getUserId(), delta.negate(), locked.getBalance());
        }

        walletStore.updateBalance(locked.getId(), newBalance);
        log.debug("Adjusted wallet {}: {} {} -> {}", locked.getId(), locked.getBalance(), delta, newBalance);
        return newBalance;
    }
}
