package com.flagship.wallet_ledger.wallet.exception;

/**
 * The unit of work could not be started, locked or committed.
 *
 * Nothing of the failed operation was persisted, so the caller may retry the
 * whole operation. The engine itself never retries.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return true;
    }
}
