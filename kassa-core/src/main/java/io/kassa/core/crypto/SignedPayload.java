package io.kassa.core.crypto;

/**
 * A structure whose big-endian encoding (size, purpose, fields) is what gets signed.
 */
public interface SignedPayload {
    int MERCHANT_REFUND = 1102;
    int MERCHANT_PAYMENT_OK = 1104;

    int purpose();

    byte[] toBytes();
}
