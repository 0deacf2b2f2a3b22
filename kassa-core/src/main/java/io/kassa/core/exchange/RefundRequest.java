package io.kassa.core.exchange;

import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.crypto.MerchantKeyPair;

public record RefundRequest(
    Amount refundAmount,
    Amount refundFee,
    HashCode hContractTerms,
    EddsaPublicKey coinPub,
    long rtransactionId,
    MerchantKeyPair merchantKeys
) {
}
