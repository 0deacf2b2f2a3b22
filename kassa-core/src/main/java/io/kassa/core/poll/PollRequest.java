package io.kassa.core.poll;

import io.kassa.core.amount.Amount;
import io.kassa.core.amount.AmountException;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantException;
import io.kassa.core.uri.RequestOrigin;
import java.time.Duration;
import java.util.Map;

/**
 * Query of {@code GET /poll-payment}. {@code timeout} is zero when the client does not want to wait.
 */
public record PollRequest(
    String orderId,
    HashCode hContractTerms,
    Duration timeout,
    Amount minRefund,
    String sessionId,
    String contractUrl,
    RequestOrigin origin
) {

    public static PollRequest fromQuery(Map<String, String> query, RequestOrigin origin) throws MerchantException {
        String orderId = query.get("order_id");
        if (orderId == null || orderId.isBlank()) {
            throw new MerchantException(ErrorCode.PARAMETER_MISSING, "order_id");
        }
        String hContract = query.get("h_contract");
        if (hContract == null) {
            throw new MerchantException(ErrorCode.PARAMETER_MISSING, "h_contract");
        }
        HashCode hContractTerms;
        try {
            hContractTerms = HashCode.fromBase32(hContract);
        } catch (IllegalArgumentException e) {
            throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, "h_contract");
        }
        Duration timeout = Duration.ZERO;
        String timeoutText = query.get("timeout");
        if (timeoutText != null) {
            try {
                long seconds = Long.parseLong(timeoutText);
                if (seconds < 0) {
                    throw new NumberFormatException(timeoutText);
                }
                timeout = Duration.ofSeconds(seconds);
            } catch (NumberFormatException e) {
                throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, "timeout must be non-negative number");
            }
        }
        Amount minRefund = null;
        String refundText = query.get("refund");
        if (refundText != null) {
            try {
                minRefund = Amount.parse(refundText);
            } catch (AmountException e) {
                throw new MerchantException(ErrorCode.PARAMETER_MALFORMED, "invalid amount given for refund argument");
            }
        }
        return new PollRequest(
            orderId,
            hContractTerms,
            timeout,
            minRefund,
            query.get("session_id"),
            query.get("contract_url"),
            origin
        );
    }
}
