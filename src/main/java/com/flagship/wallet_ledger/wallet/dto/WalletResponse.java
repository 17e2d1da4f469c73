package com.flagship.wallet_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Wallet view returned to its owner: balance plus history, newest first.
 */
@Value
@Builder
public class WalletResponse {

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;
}
