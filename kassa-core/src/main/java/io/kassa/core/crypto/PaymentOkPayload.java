package io.kassa.core.crypto;

import java.nio.ByteBuffer;
import java.util.Objects;

public record PaymentOkPayload(HashCode hContractTerms) implements SignedPayload {
    private static final int SIZE = 4 + 4 + HashCode.SIZE;

    public PaymentOkPayload {
        Objects.requireNonNull(hContractTerms, "hContractTerms must not be null");
    }

    @Override
    public int purpose() {
        return MERCHANT_PAYMENT_OK;
    }

    @Override
    public byte[] toBytes() {
        return ByteBuffer.allocate(SIZE)
            .putInt(SIZE)
            .putInt(purpose())
            .put(hContractTerms.bytes())
            .array();
    }
}
