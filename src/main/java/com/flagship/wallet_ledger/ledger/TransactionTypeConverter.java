package com.flagship.wallet_ledger.ledger;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link TransactionType} as its lowercase tag.
 */
@Converter
public class TransactionTypeConverter implements AttributeConverter<TransactionType, String> {

    @Override
    public String convertToDatabaseColumn(TransactionType type) {
        return type != null ? type.getTag() : null;
    }

    @Override
    public TransactionType convertToEntityAttribute(String tag) {
        return tag != null ? TransactionType.fromTag(tag) : null;
    }
}
