package com.flagship.wallet_ledger.transfer;

/**
 * Reference strings that tie records to business events.
 *
 * Orders are referenced as {@code ORDER:<id>}; the delivery flow passes
 * {@code DELIVERY:<id>} to the fee split.
 */
public final class References {

    public static final int MAX_LENGTH = 100;

    public static final String DEPOSIT_DEFAULT = "Added to Wallet";
    public static final String WITHDRAW_DEFAULT = "Withdrawn to Bank";

    private static final String ORDER_PREFIX = "ORDER:";

    private References() {
    }

    public static String order(Object orderId) {
        return ORDER_PREFIX + orderId;
    }

    public static String orDefault(String reference, String defaultReference) {
        return reference == null || reference.isBlank() ? defaultReference : require(reference);
    }

    /**
     * Rejects missing or oversized references. Business references are never blank.
     */
    public static String require(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Reference is required");
        }
        if (reference.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "Reference longer than " + MAX_LENGTH + " characters: " + reference.length());
        }
        return reference;
    }
}
