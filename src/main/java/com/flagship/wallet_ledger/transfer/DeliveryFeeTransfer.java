package com.flagship.wallet_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of a committed delivery-fee split.
 */
@Value
public class DeliveryFeeTransfer {
    BigDecimal ownerBalance;
    BigDecimal agentBalance;
    BigDecimal fee;
    String reference;
}
