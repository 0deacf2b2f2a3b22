package io.kassa.core.pay;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.amount.AmountException;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed body of {@code POST /pay}.
 */
record PayRequest(
    PayMode mode,
    String orderId,
    EddsaPublicKey merchantPub,
    String sessionId,
    List<PayCoin> coins
) {

    static PayRequest parse(JsonNode body) throws MerchantException {
        if (body == null || !body.isObject()) {
            throw new MerchantException(ErrorCode.JSON_INVALID, "request body must be a JSON object");
        }
        String modeName = requiredText(body, "mode");
        PayMode mode = PayMode.fromWireName(modeName)
            .orElseThrow(() -> new MerchantException(ErrorCode.PARAMETER_MALFORMED, "mode"));
        String orderId = requiredText(body, "order_id");
        EddsaPublicKey merchantPub = key(requiredText(body, "merchant_pub"), "merchant_pub");
        String sessionId = body.hasNonNull("session_id") ? body.get("session_id").asText() : null;

        JsonNode coinsNode = body.get("coins");
        if (coinsNode == null || !coinsNode.isArray()) {
            throw new MerchantException(ErrorCode.PARAMETER_MISSING, "coins");
        }
        if (coinsNode.isEmpty()) {
            throw new MerchantException(ErrorCode.PAY_COINS_ARRAY_EMPTY, "no coins given");
        }
        List<PayCoin> coins = new ArrayList<>();
        Set<EddsaPublicKey> seen = new HashSet<>();
        for (JsonNode coinNode : coinsNode) {
            PayCoin coin = parseCoin(coins.size(), coinNode);
            if (!seen.add(coin.coinPub)) {
                throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, "coin " + coin.coinPub + " given twice");
            }
            coins.add(coin);
        }
        return new PayRequest(mode, orderId, merchantPub, sessionId, coins);
    }

    private static PayCoin parseCoin(int index, JsonNode coin) throws MerchantException {
        if (!coin.isObject()) {
            throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, "coins[" + index + "]");
        }
        Amount contribution;
        try {
            contribution = Amount.parse(requiredText(coin, "contribution"));
        } catch (AmountException e) {
            throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, "coins[" + index + "].contribution");
        }
        return new PayCoin(
            index,
            key(requiredText(coin, "coin_pub"), "coins[" + index + "].coin_pub"),
            requiredText(coin, "denom_pub"),
            requiredText(coin, "ub_sig"),
            requiredText(coin, "coin_sig"),
            requiredText(coin, "exchange_url"),
            contribution
        );
    }

    private static String requiredText(JsonNode node, String field) throws MerchantException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MerchantException(ErrorCode.PARAMETER_MISSING, field);
        }
        if (!value.isTextual()) {
            throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, field);
        }
        return value.asText();
    }

    private static EddsaPublicKey key(String encoded, String field) throws MerchantException {
        try {
            return EddsaPublicKey.fromBase32(encoded);
        } catch (IllegalArgumentException e) {
            throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, field);
        }
    }
}
