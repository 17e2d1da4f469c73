package com.flagship.wallet_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * Semantic tag of a transaction record.
 *
 * Record amounts are stored as positive magnitudes; the sign of the balance
 * change is a property of the type.
 */
public enum TransactionType {
    DEBIT("debit", -1),
    CREDIT_FOR_GOODS("credit_for_goods", 1),
    DEBIT_FOR_DELIVERY("debit_for_delivery", -1),
    DELIVERY_EARNING("delivery_earning", 1),
    DEPOSIT("deposit", 1),
    WITHDRAW("withdraw", -1);

    private final String tag;
    private final int sign;

    TransactionType(String tag, int sign) {
        this.tag = tag;
        this.sign = sign;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Balance delta that a record of this type with the given magnitude explains.
     */
    public BigDecimal signed(BigDecimal amount) {
        return sign < 0 ? amount.negate() : amount;
    }

    public static TransactionType fromTag(String tag) {
        return Arrays.stream(values())
            .filter(type -> type.tag.equals(tag))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown transaction type: " + tag));
    }
}
