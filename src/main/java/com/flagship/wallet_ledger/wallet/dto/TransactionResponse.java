package com.flagship.wallet_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.wallet_ledger.ledger.TransactionRecord;
import com.flagship.wallet_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("txn_type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(TransactionRecord record) {
        return TransactionResponse.builder()
            .id(record.getId())
            .type(record.getType())
            .amount(record.getAmount())
            .reference(record.getReference())
            .createdAt(record.getCreatedAt())
            .build();
    }
}
