package io.kassa.core.crypto;

import io.kassa.core.amount.Amount;
import java.nio.ByteBuffer;
import java.util.Objects;

public record RefundRequestPayload(
    HashCode hContractTerms,
    EddsaPublicKey coinPub,
    EddsaPublicKey merchantPub,
    long rtransactionId,
    Amount refundAmount,
    Amount refundFee
) implements SignedPayload {
    private static final int SIZE = 4 + 4 + HashCode.SIZE + 2 * EddsaPublicKey.SIZE + 8 + 2 * Amount.NBO_SIZE;

    public RefundRequestPayload {
        Objects.requireNonNull(hContractTerms, "hContractTerms must not be null");
        Objects.requireNonNull(coinPub, "coinPub must not be null");
        Objects.requireNonNull(merchantPub, "merchantPub must not be null");
        Objects.requireNonNull(refundAmount, "refundAmount must not be null");
        Objects.requireNonNull(refundFee, "refundFee must not be null");
    }

    @Override
    public int purpose() {
        return MERCHANT_REFUND;
    }

    @Override
    public byte[] toBytes() {
        return ByteBuffer.allocate(SIZE)
            .putInt(SIZE)
            .putInt(purpose())
            .put(hContractTerms.bytes())
            .put(coinPub.bytes())
            .put(merchantPub.bytes())
            .putLong(rtransactionId)
            .put(refundAmount.toNbo())
            .put(refundFee.toNbo())
            .array();
    }
}
