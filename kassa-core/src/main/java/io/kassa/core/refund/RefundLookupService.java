package io.kassa.core.refund;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.contract.CanonicalJson;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.db.DbResult;
import io.kassa.core.db.MerchantDb;
import io.kassa.core.db.QueryStatus;
import io.kassa.core.db.RefundProof;
import io.kassa.core.db.RefundRecord;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.exchange.ExchangeClient;
import io.kassa.core.exchange.ExchangeOperation;
import io.kassa.core.exchange.FindExchangeResult;
import io.kassa.core.exchange.RefundRequest;
import io.kassa.core.exchange.RefundResult;
import io.kassa.core.instance.MerchantInstance;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code GET /refund}: reports every refund of an order together with the exchange's
 * confirmation. Confirmations not yet cached are obtained from the exchange, and the request
 * stays pending until all of them are back.
 */
public final class RefundLookupService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RefundLookupService.class);

    private final MerchantDb db;
    private final ExchangeClient exchanges;
    private final ExecutorService worker;
    private final Set<LookupContext> active;

    public RefundLookupService(MerchantDb db, ExchangeClient exchanges) {
        this.db = db;
        this.exchanges = exchanges;
        AtomicInteger threads = new AtomicInteger();
        this.worker = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "refund-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.active = ConcurrentHashMap.newKeySet();
    }

    public CompletableFuture<MerchantReply> lookup(MerchantInstance instance, String orderId) {
        if (orderId == null || orderId.isBlank()) {
            return CompletableFuture.completedFuture(MerchantReply.error(ErrorCode.PARAMETER_MISSING, "order_id"));
        }
        db.preflight();
        DbResult<JsonNode> terms = db.findContractTerms(orderId, instance.publicKey());
        if (terms.status().isError()) {
            return CompletableFuture.completedFuture(MerchantReply.error(
                ErrorCode.REFUND_LOOKUP_DB_ERROR,
                "database error looking up order_id from merchant_contract_terms table"
            ));
        }
        if (!terms.isFound()) {
            return CompletableFuture.completedFuture(MerchantReply.error(
                ErrorCode.REFUND_ORDER_ID_UNKNOWN,
                "order_id not found in database",
                Map.of("order_id", orderId)
            ));
        }
        HashCode hContractTerms = CanonicalJson.hash(terms.value());
        List<RefundRecord> refunds = new ArrayList<>();
        QueryStatus qs = db.getRefundsFromContractTermsHash(instance.publicKey(), hContractTerms, refunds::add);
        if (qs.isError()) {
            return CompletableFuture.completedFuture(MerchantReply.error(
                ErrorCode.REFUND_LOOKUP_DB_ERROR,
                "failed to lookup refunds for contract"
            ));
        }
        if (refunds.isEmpty()) {
            return CompletableFuture.completedFuture(MerchantReply.error(
                ErrorCode.REFUND_LOOKUP_NO_REFUND,
                "no refunds for this order",
                Map.of("order_id", orderId)
            ));
        }

        LookupContext ctx = new LookupContext(instance.retain(), hContractTerms);
        active.add(ctx);
        ctx.reply.whenComplete((reply, error) -> {
            active.remove(ctx);
            ctx.instance.release();
        });
        synchronized (ctx) {
            for (RefundRecord refund : refunds) {
                CoinRefund coin = new CoinRefund(refund);
                ctx.coins.add(coin);
                DbResult<RefundProof> proof = db.getRefundProof(
                    hContractTerms,
                    instance.publicKey(),
                    refund.coinPub(),
                    refund.rtransactionId()
                );
                if (proof.isFound()) {
                    coin.proof = proof.value();
                    continue;
                }
                if (proof.status().isError()) {
                    LOG.warn("Could not read cached refund proof for coin {}, asking the exchange", refund.coinPub());
                }
                ctx.pending++;
                coin.operation = exchanges.findExchange(refund.exchangeUrl(), null)
                    .onComplete(worker, result -> exchangeFound(ctx, coin, result));
            }
            if (ctx.pending == 0) {
                ctx.complete(buildReply(ctx));
            } else {
                LOG.debug("Refund lookup for order {} waiting on {} exchange confirmation(s)", orderId, ctx.pending);
            }
        }
        return ctx.reply.copy();
    }

    /**
     * Completes every pending lookup with {@link MerchantReply#DROP}.
     */
    public void forceResumeAll() {
        List<LookupContext> snapshot = new ArrayList<>(active);
        if (!snapshot.isEmpty()) {
            LOG.info("Force-resuming {} refund lookup(s) for shutdown", snapshot.size());
        }
        for (LookupContext ctx : snapshot) {
            synchronized (ctx) {
                ctx.complete(MerchantReply.DROP);
            }
        }
    }

    public int activeLookups() {
        return active.size();
    }

    @Override
    public void close() {
        forceResumeAll();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    private void exchangeFound(LookupContext ctx, CoinRefund coin, FindExchangeResult result) {
        synchronized (ctx) {
            if (ctx.reply.isDone()) {
                return;
            }
            coin.operation = null;
            if (!result.ok()) {
                coin.failed(result.httpStatus(), result.errorCode(), result.rawReply());
                coinDone(ctx);
                return;
            }
            RefundRecord refund = coin.refund;
            RefundRequest request = new RefundRequest(
                refund.refundAmount(),
                refund.refundFee(),
                refund.hContractTerms(),
                refund.coinPub(),
                refund.rtransactionId(),
                ctx.instance.keys()
            );
            coin.operation = exchanges.refund(result.handle(), request)
                .onComplete(worker, refunded -> refundDone(ctx, coin, refunded));
        }
    }

    private void refundDone(LookupContext ctx, CoinRefund coin, RefundResult result) {
        synchronized (ctx) {
            if (ctx.reply.isDone()) {
                return;
            }
            coin.operation = null;
            if (result.ok()) {
                RefundProof proof = new RefundProof(result.signingPub(), result.exchangeSig());
                coin.proof = proof;
                db.preflight();
                QueryStatus qs = db.putRefundProof(
                    ctx.hContractTerms,
                    ctx.instance.publicKey(),
                    coin.refund.coinPub(),
                    coin.refund.rtransactionId(),
                    proof
                );
                if (qs.isError()) {
                    LOG.warn("Failed to cache refund proof for coin {}: {}", coin.refund.coinPub(), qs);
                }
            } else {
                LOG.warn("Exchange refused refund of coin {} with status {}", coin.refund.coinPub(), result.httpStatus());
                coin.failed(result.httpStatus(), result.errorCode(), result.rawReply());
            }
            coinDone(ctx);
        }
    }

    private void coinDone(LookupContext ctx) {
        if (--ctx.pending == 0) {
            ctx.complete(buildReply(ctx));
        }
    }

    private static MerchantReply buildReply(LookupContext ctx) {
        List<Map<String, Object>> refunds = new ArrayList<>();
        for (CoinRefund coin : ctx.coins) {
            RefundRecord refund = coin.refund;
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("coin_pub", refund.coinPub().toBase32());
            entry.put("rtransaction_id", refund.rtransactionId());
            entry.put("refund_amount", refund.refundAmount().toString());
            entry.put("refund_fee", refund.refundFee().toString());
            if (coin.proof != null) {
                entry.put("exchange_pub", coin.proof.exchangePub().toBase32());
                entry.put("exchange_sig", coin.proof.exchangeSig());
            } else {
                entry.put("exchange_http_status", coin.exchangeStatus);
                entry.put("exchange_code", coin.exchangeCode);
                if (coin.exchangeReply != null) {
                    entry.put("exchange_reply", coin.exchangeReply);
                }
            }
            refunds.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("refunds", refunds);
        body.put("merchant_pub", ctx.instance.publicKey().toBase32());
        body.put("h_contract_terms", ctx.hContractTerms.toBase32());
        return MerchantReply.ok(body);
    }

    private static final class LookupContext {
        final MerchantInstance instance;
        final HashCode hContractTerms;
        final CompletableFuture<MerchantReply> reply = new CompletableFuture<>();
        final List<CoinRefund> coins = new ArrayList<>();
        int pending;

        LookupContext(MerchantInstance instance, HashCode hContractTerms) {
            this.instance = instance;
            this.hContractTerms = hContractTerms;
        }

        void complete(MerchantReply result) {
            if (reply.complete(result)) {
                coins.forEach(CoinRefund::cancel);
            }
        }
    }

    private static final class CoinRefund {
        final RefundRecord refund;
        RefundProof proof;
        int exchangeStatus;
        int exchangeCode;
        JsonNode exchangeReply;
        ExchangeOperation<?> operation;

        CoinRefund(RefundRecord refund) {
            this.refund = refund;
        }

        void failed(int status, int code, JsonNode reply) {
            exchangeStatus = status;
            exchangeCode = code;
            exchangeReply = reply;
        }

        void cancel() {
            if (operation != null) {
                operation.cancel();
                operation = null;
            }
        }
    }
}
