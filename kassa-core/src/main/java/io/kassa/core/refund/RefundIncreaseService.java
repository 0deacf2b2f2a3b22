package io.kassa.core.refund;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.amount.AmountException;
import io.kassa.core.contract.CanonicalJson;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.db.DbResult;
import io.kassa.core.db.DbTransaction;
import io.kassa.core.db.MerchantDb;
import io.kassa.core.db.QueryStatus;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.uri.RequestOrigin;
import io.kassa.core.uri.TalerUris;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code POST /refund}: raises the refund ceiling of a paid order. Wallets pick the
 * refund up through the lookup endpoint, so no waiter is woken here.
 */
public final class RefundIncreaseService {
    private static final Logger LOG = LoggerFactory.getLogger(RefundIncreaseService.class);

    private final MerchantDb db;
    private final String currency;
    private final int maxRetries;

    public RefundIncreaseService(MerchantDb db, String currency, int maxRetries) {
        this.db = db;
        this.currency = currency.toUpperCase(Locale.ROOT);
        this.maxRetries = maxRetries;
    }

    public MerchantReply increase(MerchantInstance instance, JsonNode body, RequestOrigin origin) {
        if (body == null || !body.isObject()) {
            return MerchantReply.error(ErrorCode.JSON_INVALID, "request body must be a JSON object");
        }
        for (String field : new String[] {"refund", "order_id", "reason"}) {
            if (!body.hasNonNull(field)) {
                return MerchantReply.error(ErrorCode.PARAMETER_MISSING, field);
            }
        }
        Amount refund;
        try {
            refund = Amount.parse(body.get("refund").asText());
        } catch (AmountException e) {
            return MerchantReply.error(ErrorCode.PARAMETER_MALFORMED, "refund");
        }
        if (!refund.currency().equals(currency)) {
            return MerchantReply.error(
                ErrorCode.REFUND_CURRENCY_MISMATCH,
                "refund is in " + refund.currency() + ", this backend accepts " + currency
            );
        }
        String orderId = body.get("order_id").asText();
        String reason = body.get("reason").asText();

        db.preflight();
        DbResult<JsonNode> terms = db.findContractTerms(orderId, instance.publicKey());
        if (terms.status().isError()) {
            return MerchantReply.error(ErrorCode.REFUND_LOOKUP_DB_ERROR, "an error occurred while retrieving proposal data from db");
        }
        if (!terms.isFound()) {
            return MerchantReply.error(
                ErrorCode.REFUND_ORDER_ID_UNKNOWN,
                "order_id not found in database",
                Map.of("order_id", orderId)
            );
        }
        Amount orderAmount;
        try {
            orderAmount = Amount.parse(terms.value().path("amount").asText(null));
        } catch (AmountException e) {
            LOG.error("Stored contract terms of order {} carry no valid amount", orderId, e);
            return MerchantReply.error(ErrorCode.PAY_CONTRACT_TERMS_INVALID, "contract terms of the order are corrupted");
        }
        if (!orderAmount.sameCurrency(refund)) {
            return MerchantReply.error(ErrorCode.REFUND_CURRENCY_MISMATCH, "refund currency does not match the order");
        }
        HashCode hContractTerms = CanonicalJson.hash(terms.value());

        QueryStatus qs = QueryStatus.SOFT_ERROR;
        for (int attempt = 0; attempt < maxRetries && qs == QueryStatus.SOFT_ERROR; attempt++) {
            qs = attempt(instance, hContractTerms, refund, reason);
        }
        if (qs == QueryStatus.SOFT_ERROR) {
            LOG.warn("Refund increase for order {} gave up after {} attempts", orderId, maxRetries);
            return MerchantReply.error(ErrorCode.REFUND_MERCHANT_DB_COMMIT_ERROR, "internal database error (retries exhausted)");
        }
        if (qs == QueryStatus.HARD_ERROR) {
            return MerchantReply.error(ErrorCode.REFUND_MERCHANT_DB_COMMIT_ERROR, "internal database error");
        }
        if (qs == QueryStatus.NO_RESULTS) {
            return MerchantReply.error(
                ErrorCode.REFUND_INCONSISTENT_AMOUNT,
                "amount above payment",
                Map.of("order_id", orderId, "refund", refund.toString())
            );
        }
        LOG.info("Refund ceiling of order {} raised to {}", orderId, refund);
        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("h_contract_terms", hContractTerms.toBase32());
        reply.put("taler_refund_url", TalerUris.refundUri(origin, instance, orderId));
        return MerchantReply.ok(reply);
    }

    private QueryStatus attempt(MerchantInstance instance, HashCode hContractTerms, Amount refund, String reason) {
        db.preflight();
        try (DbTransaction tx = db.start("increase refund")) {
            QueryStatus qs = tx.increaseRefundForContract(hContractTerms, instance.publicKey(), refund, reason);
            if (qs != QueryStatus.ONE_RESULT) {
                return qs;
            }
            QueryStatus committed = tx.commit();
            return committed.isError() ? committed : QueryStatus.ONE_RESULT;
        } catch (IOException e) {
            LOG.error("Failed to start refund transaction", e);
            return QueryStatus.HARD_ERROR;
        }
    }
}
