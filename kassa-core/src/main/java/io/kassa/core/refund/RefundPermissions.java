package io.kassa.core.refund;

import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.crypto.RefundRequestPayload;
import io.kassa.core.db.RefundRecord;
import io.kassa.core.instance.MerchantInstance;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merchant-signed refund permissions handed to wallets, which forward them to the exchange.
 */
public final class RefundPermissions {

    private RefundPermissions() {
    }

    public static Map<String, Object> of(MerchantInstance instance, RefundRecord refund) {
        return of(
            instance,
            refund.hContractTerms(),
            refund.coinPub(),
            refund.rtransactionId(),
            refund.refundAmount(),
            refund.refundFee()
        );
    }

    public static Map<String, Object> of(
        MerchantInstance instance,
        HashCode hContractTerms,
        EddsaPublicKey coinPub,
        long rtransactionId,
        Amount refundAmount,
        Amount refundFee
    ) {
        RefundRequestPayload payload = new RefundRequestPayload(
            hContractTerms,
            coinPub,
            instance.publicKey(),
            rtransactionId,
            refundAmount,
            refundFee
        );
        Map<String, Object> permission = new LinkedHashMap<>();
        permission.put("refund_amount", refundAmount.toString());
        permission.put("refund_fee", refundFee.toString());
        permission.put("rtransaction_id", rtransactionId);
        permission.put("coin_pub", coinPub.toBase32());
        permission.put("merchant_sig", instance.keys().signBase32(payload));
        return permission;
    }
}
