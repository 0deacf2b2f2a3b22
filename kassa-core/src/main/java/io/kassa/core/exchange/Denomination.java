package io.kassa.core.exchange;

import io.kassa.core.amount.Amount;
import java.time.Instant;

public record Denomination(
    String denomPub,
    Amount value,
    Amount feeDeposit,
    Amount feeRefund,
    Instant expireDeposit
) {
}
