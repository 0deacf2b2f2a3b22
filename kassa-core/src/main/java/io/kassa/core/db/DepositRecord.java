package io.kassa.core.db;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import java.util.Objects;

public record DepositRecord(
    HashCode hContractTerms,
    EddsaPublicKey merchantPub,
    EddsaPublicKey coinPub,
    String exchangeUrl,
    Amount amountWithFee,
    Amount depositFee,
    Amount refundFee,
    Amount wireFee,
    EddsaPublicKey exchangeSigningPub,
    JsonNode exchangeProof
) {

    public DepositRecord {
        Objects.requireNonNull(hContractTerms, "hContractTerms must not be null");
        Objects.requireNonNull(merchantPub, "merchantPub must not be null");
        Objects.requireNonNull(coinPub, "coinPub must not be null");
        Objects.requireNonNull(exchangeUrl, "exchangeUrl must not be null");
        Objects.requireNonNull(amountWithFee, "amountWithFee must not be null");
        Objects.requireNonNull(depositFee, "depositFee must not be null");
        Objects.requireNonNull(refundFee, "refundFee must not be null");
        Objects.requireNonNull(wireFee, "wireFee must not be null");
    }
}
