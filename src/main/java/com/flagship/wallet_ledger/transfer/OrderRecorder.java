package com.flagship.wallet_ledger.transfer;

/**
 * Creates the order record that an order debit pays for.
 *
 * Invoked inside the debit's transaction, after the funds check and before
 * the balance changes, so the order and its debit commit or roll back together.
 */
@FunctionalInterface
public interface OrderRecorder {

    /**
     * @return identifier of the created order, used to build the debit reference
     */
    Object recordOrder();
}
