package io.kassa.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.crypto.EddsaPublicKey;

public record RefundResult(
    int httpStatus,
    int errorCode,
    EddsaPublicKey signingPub,
    String exchangeSig,
    JsonNode rawReply
) {

    /**
     * A 200 reply only counts when it carries the exchange's signature.
     */
    public boolean ok() {
        return httpStatus == 200 && exchangeSig != null && signingPub != null;
    }
}
