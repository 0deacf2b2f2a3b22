package io.kassa.core.poll;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.amount.AmountException;
import io.kassa.core.db.DbResult;
import io.kassa.core.db.MerchantDb;
import io.kassa.core.db.QueryStatus;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.longpoll.LongPollHub;
import io.kassa.core.longpoll.ResumeReason;
import io.kassa.core.longpoll.SuspendedConnection;
import io.kassa.core.uri.TalerUris;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code GET /poll-payment}. Unpaid orders (and paid orders whose refunds have not yet
 * exceeded the requested amount) park the request in the {@link LongPollHub} until a payment
 * wakes it or its timeout runs out.
 */
public final class PollPaymentService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PollPaymentService.class);

    private final MerchantDb db;
    private final LongPollHub hub;
    private final Clock clock;
    private final ExecutorService worker;

    public PollPaymentService(MerchantDb db, LongPollHub hub, Clock clock) {
        this.db = db;
        this.hub = hub;
        this.clock = clock;
        AtomicInteger threads = new AtomicInteger();
        this.worker = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "poll-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<MerchantReply> poll(MerchantInstance instance, PollRequest request) {
        db.preflight();
        DbResult<JsonNode> terms = db.findContractTermsFromHash(request.hContractTerms(), instance.publicKey());
        if (terms.status().isError()) {
            return CompletableFuture.completedFuture(MerchantReply.error(
                ErrorCode.POLL_PAYMENT_DB_ERROR,
                "merchant database error"
            ));
        }
        if (!terms.isFound() || !request.orderId().equals(terms.value().path("order_id").asText(null))) {
            return CompletableFuture.completedFuture(MerchantReply.error(
                ErrorCode.POLL_PAYMENT_CONTRACT_NOT_FOUND,
                "given order_id doesn't map to any proposal"
            ));
        }
        if (request.minRefund() != null && !refundCurrencyMatches(terms.value(), request.minRefund())) {
            return CompletableFuture.completedFuture(MerchantReply.error(
                ErrorCode.PARAMETER_MALFORMED,
                "invalid amount given for refund argument"
            ));
        }
        PollContext ctx = new PollContext(
            instance.retain(),
            request,
            terms.value().path("fulfillment_url").asText(null),
            clock.instant().plus(request.timeout())
        );
        ctx.reply.whenComplete((reply, error) -> ctx.instance.release());
        evaluate(ctx, true);
        return ctx.reply.copy();
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }

    private void evaluate(PollContext ctx, boolean mayWait) {
        if (ctx.reply.isDone()) {
            return;
        }
        try {
            MerchantReply reply = check(ctx, mayWait);
            if (reply != null) {
                ctx.reply.complete(reply);
            }
        } catch (AmountException e) {
            LOG.error("Refund arithmetic failed while polling order {}", ctx.request.orderId(), e);
            ctx.reply.complete(MerchantReply.error(ErrorCode.INTERNAL_INVARIANT_FAILURE, "refund arithmetic failed"));
        } catch (RuntimeException e) {
            LOG.error("Polling order {} failed", ctx.request.orderId(), e);
            ctx.reply.complete(MerchantReply.error(ErrorCode.INTERNAL_INVARIANT_FAILURE, "internal error"));
        }
    }

    /**
     * Returns the reply, or null after parking the request in the hub. The waiter is registered
     * before the state is read a second time, so a payment committed in between is never missed.
     */
    private MerchantReply check(PollContext ctx, boolean mayWait) {
        PaymentState state = readState(ctx);
        if (state.error != null || !mayWait || !state.keepWaiting(ctx.request.minRefund())) {
            return reply(ctx, state);
        }
        SuspendedConnection waiter = suspend(ctx);
        if (waiter == null) {
            return reply(ctx, state);
        }
        PaymentState recheck = readState(ctx);
        if (recheck.error == null && recheck.keepWaiting(ctx.request.minRefund())) {
            return null;
        }
        if (!hub.cancel(waiter)) {
            // already resumed; the resume callback answers
            return null;
        }
        LOG.debug("Order {} changed while its poller was being parked", ctx.request.orderId());
        return reply(ctx, recheck);
    }

    private PaymentState readState(PollContext ctx) {
        PollRequest request = ctx.request;
        MerchantInstance instance = ctx.instance;
        db.preflight();

        String alreadyPaidOrderId = null;
        boolean paid;
        if (request.sessionId() != null) {
            DbResult<String> session = ctx.fulfillmentUrl == null
                ? DbResult.notFound()
                : db.findSessionInfo(request.sessionId(), ctx.fulfillmentUrl, instance.publicKey());
            if (session.status().isError()) {
                return PaymentState.failed(MerchantReply.error(ErrorCode.POLL_PAYMENT_DB_ERROR, "db error fetching pay session info"));
            }
            paid = session.isFound() && request.orderId().equals(session.value());
            if (session.isFound() && !paid) {
                alreadyPaidOrderId = session.value();
            }
        } else {
            DbResult<JsonNode> paidTerms = db.findPaidContractTermsFromHash(request.hContractTerms(), instance.publicKey());
            if (paidTerms.status().isError()) {
                return PaymentState.failed(MerchantReply.error(ErrorCode.POLL_PAYMENT_DB_ERROR, "merchant database error"));
            }
            paid = paidTerms.isFound();
        }
        if (!paid) {
            return new PaymentState(false, alreadyPaidOrderId, null, null);
        }

        Amount[] refunded = new Amount[1];
        QueryStatus qs = db.getRefundsFromContractTermsHash(
            instance.publicKey(),
            request.hContractTerms(),
            refund -> refunded[0] = refunded[0] == null ? refund.refundAmount() : refunded[0].add(refund.refundAmount())
        );
        if (qs.isError()) {
            return PaymentState.failed(MerchantReply.error(ErrorCode.POLL_PAYMENT_DB_ERROR, "merchant database error fetching refunds"));
        }
        return new PaymentState(true, null, refunded[0], null);
    }

    private static MerchantReply reply(PollContext ctx, PaymentState state) {
        if (state.error != null) {
            return state.error;
        }
        PollRequest request = ctx.request;
        Map<String, Object> body = new LinkedHashMap<>();
        if (!state.paid) {
            body.put("taler_pay_uri", TalerUris.payUri(request.origin(), ctx.instance, request.orderId(), request.sessionId()));
            body.put("contract_url", request.contractUrl() != null
                ? request.contractUrl()
                : TalerUris.contractUrl(request.origin(), ctx.instance, request.orderId()));
            body.put("paid", false);
            if (state.alreadyPaidOrderId != null) {
                body.put("already_paid_order_id", state.alreadyPaidOrderId);
            }
            return MerchantReply.ok(body);
        }
        body.put("paid", true);
        body.put("refunded", state.refunded != null);
        if (state.refunded != null) {
            body.put("refund_amount", state.refunded.toString());
        }
        return MerchantReply.ok(body);
    }

    private SuspendedConnection suspend(PollContext ctx) {
        Duration remaining = Duration.between(clock.instant(), ctx.deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return null;
        }
        return hub.suspend(
            ctx.request.orderId(),
            ctx.instance.publicKey(),
            remaining,
            ctx.request.minRefund(),
            reason -> resumed(ctx, reason)
        );
    }

    private void resumed(PollContext ctx, ResumeReason reason) {
        if (reason == ResumeReason.SHUTDOWN) {
            ctx.reply.complete(MerchantReply.DROP);
            return;
        }
        try {
            worker.execute(() -> evaluate(ctx, reason == ResumeReason.TRIGGERED));
        } catch (RejectedExecutionException e) {
            LOG.warn("Poll worker is shut down, dropping waiter on order {}", ctx.request.orderId());
            ctx.reply.complete(MerchantReply.DROP);
        }
    }

    private static boolean refundCurrencyMatches(JsonNode contractTerms, Amount minRefund) {
        try {
            return Amount.parse(contractTerms.path("amount").asText(null)).sameCurrency(minRefund);
        } catch (AmountException e) {
            return false;
        }
    }

    private static final class PaymentState {
        final boolean paid;
        final String alreadyPaidOrderId;
        final Amount refunded;
        final MerchantReply error;

        PaymentState(boolean paid, String alreadyPaidOrderId, Amount refunded, MerchantReply error) {
            this.paid = paid;
            this.alreadyPaidOrderId = alreadyPaidOrderId;
            this.refunded = refunded;
            this.error = error;
        }

        static PaymentState failed(MerchantReply error) {
            return new PaymentState(false, null, null, error);
        }

        /**
         * Unpaid orders wait; paid ones only while their refund total has not passed {@code minRefund}.
         */
        boolean keepWaiting(Amount minRefund) {
            if (!paid) {
                return true;
            }
            return minRefund != null && (refunded == null || !refunded.greaterThan(minRefund));
        }
    }

    private static final class PollContext {
        final MerchantInstance instance;
        final PollRequest request;
        final String fulfillmentUrl;
        final Instant deadline;
        final CompletableFuture<MerchantReply> reply = new CompletableFuture<>();

        PollContext(MerchantInstance instance, PollRequest request, String fulfillmentUrl, Instant deadline) {
            this.instance = instance;
            this.request = request;
            this.fulfillmentUrl = fulfillmentUrl;
            this.deadline = deadline;
        }
    }
}
