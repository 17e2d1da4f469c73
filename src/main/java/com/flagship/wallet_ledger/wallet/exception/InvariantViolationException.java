package com.flagship.wallet_ledger.wallet.exception;

/**
 * A balance adjustment and its transaction record disagree.
 * Should never happen; when it does the operation is rolled back.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
