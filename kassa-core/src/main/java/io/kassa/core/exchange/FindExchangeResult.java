package io.kassa.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;

/**
 * On success {@code handle}, {@code keys} and {@code wireFee} are set. On failure they are null
 * and {@code errorCode}, {@code httpStatus} (0 when no response) and {@code rawReply} tell why.
 */
public record FindExchangeResult(
    ExchangeHandle handle,
    ExchangeKeys keys,
    Amount wireFee,
    boolean trusted,
    int errorCode,
    int httpStatus,
    JsonNode rawReply
) {
    public static final int KEYS_FAILURE = 2001;
    public static final int CURRENCY_MISMATCH = 2002;
    public static final int WIRE_FEE_UNKNOWN = 2003;

    public static FindExchangeResult found(ExchangeHandle handle, Amount wireFee, boolean trusted) {
        return new FindExchangeResult(handle, handle.keys(), wireFee, trusted, 0, 200, null);
    }

    public static FindExchangeResult failed(int errorCode, int httpStatus, JsonNode rawReply) {
        return new FindExchangeResult(null, null, null, false, errorCode, httpStatus, rawReply);
    }

    public boolean ok() {
        return handle != null;
    }
}
