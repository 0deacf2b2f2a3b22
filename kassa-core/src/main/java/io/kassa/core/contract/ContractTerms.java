package io.kassa.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.amount.AmountException;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import java.time.Instant;
import java.util.Objects;

/**
 * Typed view over a stored contract-terms document. {@link #json()} stays the authoritative
 * form; {@link #hash()} is computed over its canonical encoding.
 */
public record ContractTerms(
    JsonNode json,
    HashCode hash,
    String orderId,
    Amount amount,
    Amount maxFee,
    Amount maxWireFee,
    int wireFeeAmortization,
    Instant timestamp,
    Instant refundDeadline,
    Instant payDeadline,
    Instant wireTransferDeadline,
    HashCode hWire,
    String fulfillmentUrl,
    EddsaPublicKey merchantPub
) {

    public ContractTerms {
        Objects.requireNonNull(json, "json must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
    }

    public static ContractTerms parse(JsonNode json) throws ContractTermsException {
        Objects.requireNonNull(json, "json must not be null");
        if (!json.isObject()) {
            throw new ContractTermsException("contract terms must be a JSON object");
        }
        try {
            Amount amount = Amount.parse(requiredText(json, "amount"));
            Amount maxFee = Amount.parse(requiredText(json, "max_fee"));
            Amount maxWireFee = json.hasNonNull("max_wire_fee")
                ? Amount.parse(json.get("max_wire_fee").asText())
                : Amount.zero(amount.currency());
            int amortization = json.hasNonNull("wire_fee_amortization")
                ? json.get("wire_fee_amortization").asInt(0)
                : 1;
            if (amortization < 1) {
                throw new ContractTermsException("wire_fee_amortization must be at least 1");
            }
            Instant refundDeadline = Timestamps.parse(json.get("refund_deadline"));
            Instant wireTransferDeadline = Timestamps.parse(json.get("wire_transfer_deadline"));
            if (refundDeadline.isAfter(wireTransferDeadline)) {
                throw new ContractTermsException("refund_deadline after wire_transfer_deadline");
            }
            return new ContractTerms(
                json,
                CanonicalJson.hash(json),
                json.path("order_id").asText(""),
                amount,
                maxFee,
                maxWireFee,
                amortization,
                Timestamps.parse(json.get("timestamp")),
                refundDeadline,
                Timestamps.parse(json.get("pay_deadline")),
                wireTransferDeadline,
                HashCode.fromBase32(requiredText(json, "h_wire")),
                json.path("fulfillment_url").asText(null),
                EddsaPublicKey.fromBase32(requiredText(json, "merchant_pub"))
            );
        } catch (AmountException | IllegalArgumentException e) {
            throw new ContractTermsException("malformed contract terms: " + e.getMessage(), e);
        }
    }

    public String currency() {
        return amount.currency();
    }

    private static String requiredText(JsonNode json, String field) throws ContractTermsException {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual()) {
            throw new ContractTermsException("contract terms lack field '" + field + "'");
        }
        return value.asText();
    }
}
