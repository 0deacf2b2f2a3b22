package io.kassa.core.error;

/**
 * Numeric error codes reported in {@code {"code": ..., "hint": ...}} bodies, each with the
 * HTTP status it is normally sent with.
 */
public enum ErrorCode {
    NONE(0, 200),
    INTERNAL_INVARIANT_FAILURE(60, 500),
    JSON_INVALID(20, 400),
    PARAMETER_MISSING(9, 400),
    PARAMETER_MALFORMED(10, 400),
    ENDPOINT_UNKNOWN(11, 404),
    METHOD_NOT_ALLOWED(12, 405),
    INSTANCE_UNKNOWN(2000, 404),

    PAY_WRONG_INSTANCE(2102, 400),
    PAY_DB_FETCH_PAY_ERROR(2103, 500),
    PAY_DB_FETCH_TRANSACTION_ERROR(2104, 500),
    PAY_DB_STORE_PAY_ERROR(2105, 500),
    PAY_DB_STORE_TRANSACTION_ERROR(2106, 500),
    PAY_DB_START_ERROR(2107, 500),
    PAY_DB_RETRIES_EXHAUSTED(2108, 500),
    PAY_PROPOSAL_NOT_FOUND(2110, 404),
    PAY_OFFER_EXPIRED(2111, 410),
    PAY_WIRE_HASH_UNKNOWN(2112, 500),
    PAY_FAILED_COMPUTE_PROPOSAL_HASH(2113, 500),
    PAY_CONTRACT_TERMS_INVALID(2114, 500),
    PAY_COINS_ARRAY_EMPTY(2115, 400),
    PAY_FEES_EXCEED_PAYMENT(2116, 400),
    PAY_WIRE_FEE_CURRENCY_MISMATCH(2117, 412),
    PAY_CURRENCY_MISMATCH(2118, 412),
    PAY_AMOUNT_OVERFLOW(2119, 500),
    PAY_REFUNDED(2120, 402),
    PAY_PAYMENT_INSUFFICIENT_DUE_TO_FEES(2121, 400),
    PAY_PAYMENT_INSUFFICIENT(2122, 400),
    PAY_EXCHANGE_FAILED(2123, 503),
    PAY_EXCHANGE_REPLY_MALFORMED(2124, 424),
    PAY_INSUFFICIENT_FUNDS(2125, 409),
    PAY_EXCHANGE_REJECTED(2126, 424),
    PAY_EXCHANGE_TIMEOUT(2127, 408),
    PAY_EXCHANGE_KEYS_FAILURE(2128, 424),
    PAY_DENOMINATION_KEY_NOT_FOUND(2129, 424),
    PAY_DENOMINATION_KEY_AUDITOR_FAILURE(2130, 400),
    PAY_DENOMINATION_DEPOSIT_EXPIRED(2131, 410),
    PAY_ABORT_REFUND_REFUSED_PAYMENT_COMPLETE(2132, 403),
    PAY_COIN_CONFLICT(2133, 409),

    POLL_PAYMENT_CONTRACT_NOT_FOUND(2501, 404),
    POLL_PAYMENT_DB_ERROR(2502, 500),

    REFUND_ORDER_ID_UNKNOWN(2601, 404),
    REFUND_INCONSISTENT_AMOUNT(2602, 409),
    REFUND_MERCHANT_DB_COMMIT_ERROR(2603, 500),
    REFUND_LOOKUP_DB_ERROR(2604, 500),
    REFUND_LOOKUP_NO_REFUND(2605, 404),
    REFUND_CURRENCY_MISMATCH(2606, 412);

    private final int code;
    private final int httpStatus;

    ErrorCode(int code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public int code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
