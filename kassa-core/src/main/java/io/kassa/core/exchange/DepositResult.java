package io.kassa.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.crypto.EddsaPublicKey;

/**
 * Exchange answer to a deposit. {@code rawReply} is null when the body was not JSON.
 */
public record DepositResult(
    int httpStatus,
    int errorCode,
    String exchangeSig,
    EddsaPublicKey signingPub,
    JsonNode rawReply
) {
    public static final int INSUFFICIENT_FUNDS = 1205;

    /**
     * A 200 reply only counts when it carries the exchange's signature.
     */
    public boolean ok() {
        return httpStatus == 200 && exchangeSig != null && signingPub != null;
    }
}
