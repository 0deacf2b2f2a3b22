package io.kassa.core.api;

import io.kassa.core.instance.InstanceRegistry;
import io.kassa.core.longpoll.LongPollHub;
import io.kassa.core.pay.PayService;
import io.kassa.core.poll.PollPaymentService;
import io.kassa.core.refund.RefundIncreaseService;
import io.kassa.core.refund.RefundLookupService;
import java.util.Objects;

/**
 * The services a {@link MerchantHttpServer} routes requests to.
 */
public record MerchantBackend(
    InstanceRegistry instances,
    PayService pay,
    RefundIncreaseService refundIncrease,
    RefundLookupService refundLookup,
    PollPaymentService pollPayment,
    LongPollHub hub
) {

    public MerchantBackend {
        Objects.requireNonNull(instances, "instances must not be null");
        Objects.requireNonNull(pay, "pay must not be null");
        Objects.requireNonNull(refundIncrease, "refundIncrease must not be null");
        Objects.requireNonNull(refundLookup, "refundLookup must not be null");
        Objects.requireNonNull(pollPayment, "pollPayment must not be null");
        Objects.requireNonNull(hub, "hub must not be null");
    }
}
