package io.kassa.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import java.time.Instant;

public record DepositRequest(
    Amount amountWithFee,
    Instant wireTransferDeadline,
    JsonNode jWire,
    HashCode hWire,
    HashCode hContractTerms,
    EddsaPublicKey coinPub,
    String denomSig,
    String denomPub,
    Instant timestamp,
    EddsaPublicKey merchantPub,
    Instant refundDeadline,
    String coinSig
) {
}
