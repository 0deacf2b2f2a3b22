package io.kassa.core.pay;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.AmountOverflowException;
import io.kassa.core.amount.CurrencyMismatchException;
import io.kassa.core.contract.ContractTerms;
import io.kassa.core.contract.ContractTermsException;
import io.kassa.core.crypto.PaymentOkPayload;
import io.kassa.core.db.DbResult;
import io.kassa.core.db.DbTransaction;
import io.kassa.core.db.DepositRecord;
import io.kassa.core.db.MerchantDb;
import io.kassa.core.db.QueryStatus;
import io.kassa.core.db.RefundRecord;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantException;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.exchange.AuditorPolicy;
import io.kassa.core.exchange.Denomination;
import io.kassa.core.exchange.DepositRequest;
import io.kassa.core.exchange.DepositResult;
import io.kassa.core.exchange.ExchangeClient;
import io.kassa.core.exchange.FindExchangeResult;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.longpoll.LongPollHub;
import io.kassa.core.refund.RefundPermissions;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes {@code /pay} requests: reconciles the request's coins with stored deposits, deposits
 * the missing ones exchange by exchange, and finally marks the order paid in one transaction.
 *
 * <p>Each request runs as a sequence of steps on the worker pool. Steps of the same request never
 * overlap; exchange callbacks and the timeout re-enter through {@link #runStep}.
 */
public final class PayService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PayService.class);

    public static final Duration DEFAULT_PAY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_RETRIES = 5;

    private final MerchantDb db;
    private final String currency;
    private final ExchangeClient exchanges;
    private final LongPollHub hub;
    private final AuditorPolicy auditors;
    private final Duration payTimeout;
    private final int maxRetries;
    private final Clock clock;
    private final ExecutorService worker;
    private final ScheduledExecutorService timer;
    private final Set<PayContext> active;
    private final AtomicLong ids;

    public PayService(
        MerchantDb db,
        String currency,
        ExchangeClient exchanges,
        LongPollHub hub,
        AuditorPolicy auditors,
        Duration payTimeout,
        int maxRetries,
        Clock clock
    ) {
        this.db = db;
        this.currency = currency.toUpperCase(Locale.ROOT);
        this.exchanges = exchanges;
        this.hub = hub;
        this.auditors = auditors;
        this.payTimeout = payTimeout;
        this.maxRetries = maxRetries;
        this.clock = clock;
        AtomicInteger threads = new AtomicInteger();
        this.worker = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "pay-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pay-timeout");
            thread.setDaemon(true);
            return thread;
        });
        this.active = ConcurrentHashMap.newKeySet();
        this.ids = new AtomicLong();
    }

    /**
     * Starts processing a pay request. The returned future completes with the reply, or with
     * {@link MerchantReply#DROP} when the service is shut down first.
     */
    public CompletableFuture<MerchantReply> pay(MerchantInstance instance, JsonNode body) {
        PayContext ctx = new PayContext(ids.incrementAndGet(), instance.retain());
        active.add(ctx);
        ctx.reply.whenComplete((reply, error) -> cleanup(ctx));
        try {
            worker.execute(() -> runStep(ctx, () -> parse(ctx, body)));
        } catch (RejectedExecutionException e) {
            LOG.warn("Pay service is shut down, dropping request {}", ctx.id);
            ctx.complete(MerchantReply.DROP);
        }
        return ctx.reply.copy();
    }

    public int activeRequests() {
        return active.size();
    }

    /**
     * Completes every in-flight request with {@link MerchantReply#DROP}, cancelling their exchange
     * calls and timeouts.
     */
    public void forceResumeAll() {
        List<PayContext> snapshot = new ArrayList<>(active);
        if (!snapshot.isEmpty()) {
            LOG.info("Force-resuming {} pay request(s) for shutdown", snapshot.size());
        }
        for (PayContext ctx : snapshot) {
            synchronized (ctx) {
                ctx.complete(MerchantReply.DROP);
            }
        }
    }

    @Override
    public void close() {
        forceResumeAll();
        worker.shutdown();
        timer.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface Step {
        void run() throws MerchantException;
    }

    private void runStep(PayContext ctx, Step step) {
        synchronized (ctx) {
            if (ctx.isDone()) {
                return;
            }
            try {
                step.run();
            } catch (MerchantException e) {
                ctx.complete(e.reply());
            } catch (CurrencyMismatchException e) {
                ctx.complete(MerchantReply.error(ErrorCode.PAY_CURRENCY_MISMATCH, e.getMessage()));
            } catch (AmountOverflowException e) {
                LOG.error("Amount overflow in pay request {}", ctx.id, e);
                ctx.complete(MerchantReply.error(ErrorCode.PAY_AMOUNT_OVERFLOW, "overflow adding up amounts"));
            } catch (RuntimeException e) {
                LOG.error("Pay request {} failed", ctx.id, e);
                ctx.complete(MerchantReply.error(ErrorCode.INTERNAL_INVARIANT_FAILURE, "internal error"));
            }
        }
    }

    private void cleanup(PayContext ctx) {
        active.remove(ctx);
        ctx.instance.release();
        LOG.debug("Pay request {} finished", ctx.id);
    }

    private void parse(PayContext ctx, JsonNode body) throws MerchantException {
        PayRequest request = PayRequest.parse(body);
        MerchantInstance instance = ctx.instance;
        if (!request.merchantPub().equals(instance.publicKey())) {
            throw new MerchantException(
                ErrorCode.PAY_WRONG_INSTANCE,
                "merchant_pub does not belong to instance " + instance.id()
            );
        }
        db.preflight();
        DbResult<JsonNode> terms = db.findContractTerms(request.orderId(), instance.publicKey());
        if (terms.status().isError()) {
            throw new MerchantException(ErrorCode.PAY_DB_FETCH_PAY_ERROR, "failed to obtain contract terms from DB");
        }
        if (!terms.isFound()) {
            throw new MerchantException(ErrorCode.PAY_PROPOSAL_NOT_FOUND, "proposal not found");
        }
        ContractTerms contract;
        try {
            contract = ContractTerms.parse(terms.value());
        } catch (ContractTermsException e) {
            LOG.error("Stored contract terms of order {} are invalid", request.orderId(), e);
            throw new MerchantException(ErrorCode.PAY_CONTRACT_TERMS_INVALID, e.getMessage());
        }
        if (!contract.currency().equals(currency)) {
            throw new MerchantException(
                ErrorCode.PAY_CURRENCY_MISMATCH,
                "contract is in " + contract.currency() + ", this backend accepts " + currency
            );
        }
        for (PayCoin coin : request.coins()) {
            if (!coin.amountWithFee.currency().equals(contract.currency())) {
                throw new MerchantException(
                    ErrorCode.PAY_CURRENCY_MISMATCH,
                    "coin contribution in " + coin.amountWithFee.currency() + ", contract in " + contract.currency()
                );
            }
        }
        if (contract.payDeadline().isBefore(clock.instant())) {
            throw new MerchantException(MerchantReply.error(
                ErrorCode.PAY_OFFER_EXPIRED,
                "the offer has expired and cannot be paid any longer",
                details("pay_deadline", contract.payDeadline().toString())
            ));
        }
        ctx.wireMethod = instance.findWireMethod(contract.hWire())
            .orElseThrow(() -> new MerchantException(
                ErrorCode.PAY_WIRE_HASH_UNKNOWN,
                "contract refers to an unknown wire transfer method"
            ));
        ctx.request = request;
        ctx.contract = contract;
        LOG.debug("Pay request {} for order {} in mode {} with {} coin(s)",
            ctx.id, request.orderId(), request.mode().wireName(), request.coins().size());
        beginTransaction(ctx);
    }

    private void beginTransaction(PayContext ctx) throws MerchantException {
        while (!ctx.isDone()) {
            if (++ctx.retryCounter > maxRetries) {
                LOG.warn("Pay request {} gave up after {} database attempts", ctx.id, maxRetries);
                throw new MerchantException(ErrorCode.PAY_DB_RETRIES_EXHAUSTED, "soft merchant database error: retry counter exceeded");
            }
            if (!attemptTransaction(ctx)) {
                return;
            }
            LOG.debug("Pay request {} retrying after soft database error", ctx.id);
        }
    }

    /**
     * One transaction attempt. Returns true when the attempt hit a soft error and has to be retried.
     */
    private boolean attemptTransaction(PayContext ctx) throws MerchantException {
        ctx.resetAccumulators();
        ContractTerms contract = ctx.contract;
        MerchantInstance instance = ctx.instance;
        db.preflight();
        DbTransaction tx;
        try {
            tx = db.start(ctx.request.mode() == PayMode.PAY ? "run pay" : "run abort-refund");
        } catch (IOException e) {
            LOG.error("Failed to start transaction for pay request {}", ctx.id, e);
            throw new MerchantException(ErrorCode.PAY_DB_START_ERROR, "merchant database error (could not start transaction)");
        }
        try (tx) {
            QueryStatus qs = tx.findPayments(contract.hash(), instance.publicKey(), deposit -> checkCoinPaid(ctx, deposit));
            if (qs == QueryStatus.SOFT_ERROR) {
                return true;
            }
            if (qs == QueryStatus.HARD_ERROR) {
                throw new MerchantException(ErrorCode.PAY_DB_FETCH_TRANSACTION_ERROR, "merchant database error");
            }
            if (ctx.conflictingCoin != null) {
                throw new MerchantException(MerchantReply.error(
                    ErrorCode.PAY_COIN_CONFLICT,
                    "coin was already deposited for this contract with a different amount",
                    details("coin_pub", ctx.conflictingCoin.toBase32())
                ));
            }
            qs = tx.getRefundsFromContractTermsHash(instance.publicKey(), contract.hash(), refund -> checkCoinRefunded(ctx, refund));
            if (qs == QueryStatus.SOFT_ERROR) {
                return true;
            }
            if (qs == QueryStatus.HARD_ERROR) {
                throw new MerchantException(ErrorCode.PAY_DB_FETCH_TRANSACTION_ERROR, "merchant database error checking for refunds");
            }

            if (ctx.request.mode() == PayMode.ABORT_REFUND) {
                return abortRefund(ctx, tx);
            }

            if (ctx.pending > 0) {
                tx.rollback();
                findNextExchange(ctx);
                return false;
            }

            Optional<MerchantReply> insufficient = PaymentSufficiency.check(contract, ctx.coins(), ctx.totalRefunded);
            if (insufficient.isPresent()) {
                ctx.complete(insufficient.get());
                return false;
            }

            qs = tx.markProposalPaid(contract.hash(), instance.publicKey());
            if (qs == QueryStatus.SOFT_ERROR) {
                return true;
            }
            if (qs.isError()) {
                throw new MerchantException(ErrorCode.PAY_DB_STORE_TRANSACTION_ERROR, "merchant database error: could not mark proposal as paid");
            }
            String sessionId = ctx.request.sessionId();
            if (sessionId != null && contract.fulfillmentUrl() != null) {
                qs = tx.insertSessionInfo(sessionId, contract.fulfillmentUrl(), ctx.request.orderId(), instance.publicKey());
                if (qs == QueryStatus.SOFT_ERROR) {
                    return true;
                }
                if (qs.isError()) {
                    throw new MerchantException(ErrorCode.PAY_DB_STORE_TRANSACTION_ERROR, "merchant database error: could not store session info");
                }
            }
            qs = tx.commit();
            if (qs == QueryStatus.SOFT_ERROR) {
                return true;
            }
            if (qs.isError()) {
                throw new MerchantException(ErrorCode.PAY_DB_STORE_TRANSACTION_ERROR, "merchant database error: could not commit");
            }
        }
        LOG.info("Order {} paid", ctx.request.orderId());
        hub.resume(ctx.request.orderId(), instance.publicKey(), null);
        ctx.complete(successReply(ctx));
        return false;
    }

    private boolean abortRefund(PayContext ctx, DbTransaction tx) throws MerchantException {
        ContractTerms contract = ctx.contract;
        MerchantInstance instance = ctx.instance;
        DbResult<JsonNode> paid = tx.findPaidContractTermsFromHash(contract.hash(), instance.publicKey());
        if (paid.status() == QueryStatus.SOFT_ERROR) {
            return true;
        }
        if (paid.status().isError()) {
            throw new MerchantException(ErrorCode.PAY_DB_FETCH_TRANSACTION_ERROR, "merchant database error");
        }
        if (paid.isFound()) {
            tx.rollback();
            throw new MerchantException(
                ErrorCode.PAY_ABORT_REFUND_REFUSED_PAYMENT_COMPLETE,
                "payment complete, refusing to abort"
            );
        }
        QueryStatus qs = tx.increaseRefundForContract(
            contract.hash(),
            instance.publicKey(),
            ctx.totalPaid,
            "incomplete payment aborted"
        );
        if (qs == QueryStatus.SOFT_ERROR) {
            return true;
        }
        if (qs.isError()) {
            throw new MerchantException(ErrorCode.PAY_DB_STORE_TRANSACTION_ERROR, "merchant database error storing abort-refund");
        }
        qs = tx.commit();
        if (qs == QueryStatus.SOFT_ERROR) {
            return true;
        }
        if (qs.isError()) {
            throw new MerchantException(ErrorCode.PAY_DB_STORE_TRANSACTION_ERROR, "merchant database error: could not commit");
        }
        List<Map<String, Object>> permissions = new ArrayList<>();
        for (PayCoin coin : ctx.coins()) {
            if (coin.foundInDb) {
                permissions.add(RefundPermissions.of(
                    instance,
                    contract.hash(),
                    coin.coinPub,
                    0,
                    coin.amountWithFee,
                    coin.refundFee
                ));
            }
        }
        LOG.info("Aborted payment of order {}, refunding {}", ctx.request.orderId(), ctx.totalPaid);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("refund_permissions", permissions);
        body.put("merchant_pub", instance.publicKey().toBase32());
        body.put("h_contract_terms", contract.hash().toBase32());
        ctx.complete(MerchantReply.ok(body));
        return false;
    }

    private void checkCoinPaid(PayContext ctx, DepositRecord deposit) {
        for (PayCoin coin : ctx.coins()) {
            if (!coin.coinPub.equals(deposit.coinPub())) {
                continue;
            }
            if (!coin.amountWithFee.equals(deposit.amountWithFee())) {
                ctx.conflictingCoin = coin.coinPub;
                continue;
            }
            if (coin.foundInDb) {
                continue;
            }
            coin.foundInDb = true;
            coin.depositFee = deposit.depositFee();
            coin.refundFee = deposit.refundFee();
            coin.wireFee = deposit.wireFee();
            ctx.totalPaid = ctx.totalPaid.add(deposit.amountWithFee());
            ctx.totalFeesPaid = ctx.totalFeesPaid.add(deposit.depositFee());
            ctx.pending--;
        }
    }

    private void checkCoinRefunded(PayContext ctx, RefundRecord refund) {
        for (PayCoin coin : ctx.coins()) {
            if (coin.coinPub.equals(refund.coinPub())) {
                coin.refunded = true;
                ctx.totalRefunded = ctx.totalRefunded.add(refund.refundAmount());
            }
        }
    }

    private void findNextExchange(PayContext ctx) throws MerchantException {
        ctx.currentExchange = null;
        for (PayCoin coin : ctx.coins()) {
            if (!coin.foundInDb) {
                ctx.currentExchange = coin.exchangeUrl;
                break;
            }
        }
        if (ctx.currentExchange == null) {
            beginTransaction(ctx);
            return;
        }
        if (ctx.timeout == null) {
            ctx.timeout = timer.schedule(() -> handleTimeout(ctx), payTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        LOG.debug("Pay request {} looking up exchange {}", ctx.id, ctx.currentExchange);
        ctx.findOperation = exchanges.findExchange(ctx.currentExchange, ctx.wireMethod.wireMethod())
            .onComplete(worker, result -> runStep(ctx, () -> processPayWithExchange(ctx, result)));
    }

    private void processPayWithExchange(PayContext ctx, FindExchangeResult result) throws MerchantException {
        ctx.findOperation = null;
        if (!result.ok()) {
            LOG.warn("Exchange {} lookup failed with status {} and code {}",
                ctx.currentExchange, result.httpStatus(), result.errorCode());
            throw new MerchantException(MerchantReply.error(
                ErrorCode.PAY_EXCHANGE_KEYS_FAILURE,
                "failed to obtain exchange keys",
                details(
                    "exchange_url", ctx.currentExchange,
                    "exchange_code", result.errorCode(),
                    "exchange_http_status", result.httpStatus(),
                    "exchange_reply", result.rawReply()
                )
            ));
        }
        if (hasUnknownDenomination(ctx, result) && ctx.refreshedExchanges.add(ctx.currentExchange)) {
            LOG.info("Pay request {} refreshing keys of exchange {} for an unknown denomination", ctx.id, ctx.currentExchange);
            ctx.findOperation = exchanges.refreshExchange(ctx.currentExchange, ctx.wireMethod.wireMethod())
                .onComplete(worker, refreshed -> runStep(ctx, () -> processPayWithExchange(ctx, refreshed)));
            return;
        }
        List<PayCoin> batch = new ArrayList<>();
        for (PayCoin coin : ctx.coins()) {
            if (coin.foundInDb || !coin.exchangeUrl.equals(ctx.currentExchange)) {
                continue;
            }
            Denomination denomination = result.keys().findDenomination(coin.denomPub)
                .orElseThrow(() -> new MerchantException(MerchantReply.error(
                    ErrorCode.PAY_DENOMINATION_KEY_NOT_FOUND,
                    "denomination not found",
                    details("denom_pub", coin.denomPub, "exchange_url", ctx.currentExchange)
                )));
            Optional<ErrorCode> refusal = auditors.check(result.keys(), denomination, result.trusted());
            if (refusal.isPresent()) {
                throw new MerchantException(MerchantReply.error(
                    refusal.get(),
                    refusal.get() == ErrorCode.PAY_DENOMINATION_DEPOSIT_EXPIRED
                        ? "denomination expired for deposits"
                        : "denomination not accepted by any trusted auditor",
                    details("denom_pub", coin.denomPub)
                ));
            }
            coin.depositFee = denomination.feeDeposit();
            coin.refundFee = denomination.feeRefund();
            coin.wireFee = result.wireFee();
            batch.add(coin);
        }
        ctx.pendingAtCe = batch.size();
        if (batch.isEmpty()) {
            findNextExchange(ctx);
            return;
        }
        ContractTerms contract = ctx.contract;
        for (PayCoin coin : batch) {
            DepositRequest request = new DepositRequest(
                coin.amountWithFee,
                contract.wireTransferDeadline(),
                ctx.wireMethod.jWire(),
                ctx.wireMethod.hWire(),
                contract.hash(),
                coin.coinPub,
                coin.denomSig,
                coin.denomPub,
                contract.timestamp(),
                ctx.instance.publicKey(),
                contract.refundDeadline(),
                coin.coinSig
            );
            LOG.debug("Pay request {} depositing coin {} at {}", ctx.id, coin.coinPub, ctx.currentExchange);
            coin.depositOperation = exchanges.deposit(result.handle(), request)
                .onComplete(worker, deposit -> runStep(ctx, () -> depositCallback(ctx, coin, deposit)));
        }
    }

    private static boolean hasUnknownDenomination(PayContext ctx, FindExchangeResult result) {
        for (PayCoin coin : ctx.coins()) {
            if (!coin.foundInDb
                && coin.exchangeUrl.equals(ctx.currentExchange)
                && result.keys().findDenomination(coin.denomPub).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private void depositCallback(PayContext ctx, PayCoin coin, DepositResult result) throws MerchantException {
        coin.depositOperation = null;
        if (!result.ok()) {
            LOG.warn("Deposit of coin {} failed with status {} and code {}",
                coin.coinPub, result.httpStatus(), result.errorCode());
            for (PayCoin sibling : ctx.coins()) {
                sibling.cancelDeposit();
            }
            throw new MerchantException(depositFailure(coin, result));
        }
        db.preflight();
        QueryStatus qs = db.storeDeposit(new DepositRecord(
            ctx.contract.hash(),
            ctx.instance.publicKey(),
            coin.coinPub,
            coin.exchangeUrl,
            coin.amountWithFee,
            coin.depositFee,
            coin.refundFee,
            coin.wireFee,
            result.signingPub(),
            result.rawReply()
        ));
        if (qs == QueryStatus.SOFT_ERROR) {
            LOG.warn("Soft error storing deposit of coin {}, restarting pay request {}", coin.coinPub, ctx.id);
            for (PayCoin sibling : ctx.coins()) {
                sibling.cancelDeposit();
            }
            beginTransaction(ctx);
            return;
        }
        if (qs.isError()) {
            throw new MerchantException(ErrorCode.PAY_DB_STORE_PAY_ERROR, "merchant database error storing deposit");
        }
        coin.foundInDb = true;
        ctx.pending--;
        if (--ctx.pendingAtCe == 0) {
            findNextExchange(ctx);
        }
    }

    private static MerchantReply depositFailure(PayCoin coin, DepositResult result) {
        int status = result.httpStatus();
        if (status == 0 || status >= 500) {
            return MerchantReply.error(
                ErrorCode.PAY_EXCHANGE_FAILED,
                "exchange failed to process the deposit",
                details("coin_pub", coin.coinPub.toBase32(), "exchange_http_status", status)
            );
        }
        if (result.rawReply() == null) {
            return MerchantReply.error(
                ErrorCode.PAY_EXCHANGE_REPLY_MALFORMED,
                "exchange reply to the deposit was not JSON",
                details("coin_pub", coin.coinPub.toBase32(), "exchange_http_status", status)
            );
        }
        if (result.errorCode() == DepositResult.INSUFFICIENT_FUNDS) {
            return MerchantReply.error(
                ErrorCode.PAY_INSUFFICIENT_FUNDS,
                "coin has insufficient funds",
                details(
                    "coin_pub", coin.coinPub.toBase32(),
                    "exchange_code", result.errorCode(),
                    "exchange_reply", result.rawReply()
                )
            );
        }
        return MerchantReply.error(
            ErrorCode.PAY_EXCHANGE_REJECTED,
            "exchange refused the deposit",
            details(
                "coin_pub", coin.coinPub.toBase32(),
                "exchange_http_status", status,
                "exchange_code", result.errorCode(),
                "exchange_reply", result.rawReply()
            )
        );
    }

    private void handleTimeout(PayContext ctx) {
        runStep(ctx, () -> {
            ctx.timeout = null;
            LOG.warn("Pay request {} timed out waiting for exchange {}", ctx.id, ctx.currentExchange);
            if (ctx.findOperation != null) {
                ctx.findOperation.cancel();
                ctx.findOperation = null;
            }
            ctx.complete(MerchantReply.error(
                ErrorCode.PAY_EXCHANGE_TIMEOUT,
                "likely the exchange did not reply quickly enough",
                details("exchange_url", ctx.currentExchange)
            ));
        });
    }

    private MerchantReply successReply(PayContext ctx) throws MerchantException {
        MerchantInstance instance = ctx.instance;
        ContractTerms contract = ctx.contract;
        List<Map<String, Object>> permissions = new ArrayList<>();
        db.preflight();
        QueryStatus qs = db.getRefundsFromContractTermsHash(
            instance.publicKey(),
            contract.hash(),
            refund -> permissions.add(RefundPermissions.of(instance, refund))
        );
        if (qs.isError()) {
            throw new MerchantException(ErrorCode.PAY_DB_FETCH_TRANSACTION_ERROR, "failed to lookup refunds");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contract_terms", contract.json());
        body.put("sig", instance.keys().signBase32(new PaymentOkPayload(contract.hash())));
        body.put("h_contract_terms", contract.hash().toBase32());
        body.put("refund_permissions", permissions);
        return MerchantReply.ok(body);
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put((String) keyValues[i], keyValues[i + 1]);
        }
        return details;
    }
}
