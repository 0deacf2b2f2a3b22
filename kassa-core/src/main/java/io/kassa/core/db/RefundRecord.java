package io.kassa.core.db;

import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;

/**
 * One refund row; {@code exchangeUrl} comes from the deposit of the refunded coin.
 */
public record RefundRecord(
    HashCode hContractTerms,
    EddsaPublicKey merchantPub,
    EddsaPublicKey coinPub,
    String exchangeUrl,
    long rtransactionId,
    String reason,
    Amount refundAmount,
    Amount refundFee
) {
}
