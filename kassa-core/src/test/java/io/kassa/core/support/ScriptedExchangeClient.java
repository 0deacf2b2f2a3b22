package io.kassa.core.support;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.exchange.DepositRequest;
import io.kassa.core.exchange.DepositResult;
import io.kassa.core.exchange.ExchangeClient;
import io.kassa.core.exchange.ExchangeHandle;
import io.kassa.core.exchange.ExchangeKeys;
import io.kassa.core.exchange.ExchangeOperation;
import io.kassa.core.exchange.FindExchangeResult;
import io.kassa.core.exchange.RefundRequest;
import io.kassa.core.exchange.RefundResult;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory exchange whose replies are set up per exchange URL and per coin. Exchanges and coin
 * deposits marked silent never answer. A refresh answers with the keys set up through
 * {@link #withRefreshedExchange}, or like a plain lookup when there are none.
 */
public final class ScriptedExchangeClient implements ExchangeClient {
    private final Map<String, FindExchangeResult> exchanges = new ConcurrentHashMap<>();
    private final Map<String, FindExchangeResult> refreshed = new ConcurrentHashMap<>();
    private final Set<String> silent = ConcurrentHashMap.newKeySet();
    private final Set<EddsaPublicKey> silentDeposits = ConcurrentHashMap.newKeySet();
    private final Map<EddsaPublicKey, DepositResult> depositReplies = new ConcurrentHashMap<>();
    private final Map<EddsaPublicKey, RefundResult> refundReplies = new ConcurrentHashMap<>();
    private final List<DepositRequest> deposits = new CopyOnWriteArrayList<>();
    private final List<RefundRequest> refunds = new CopyOnWriteArrayList<>();
    private final List<String> lookups = new CopyOnWriteArrayList<>();
    private final AtomicInteger findCalls = new AtomicInteger();
    private final AtomicInteger refreshCalls = new AtomicInteger();
    private final AtomicInteger cancellations = new AtomicInteger();
    private final EddsaPublicKey signingKey = MerchantFixtures.randomKey();

    public ScriptedExchangeClient withExchange(String url, ExchangeKeys keys, Amount wireFee) {
        exchanges.put(url, FindExchangeResult.found(new ExchangeHandle(url, keys), wireFee, true));
        return this;
    }

    public ScriptedExchangeClient withUntrustedExchange(String url, ExchangeKeys keys, Amount wireFee) {
        exchanges.put(url, FindExchangeResult.found(new ExchangeHandle(url, keys), wireFee, false));
        return this;
    }

    public ScriptedExchangeClient withBrokenExchange(String url, int httpStatus, JsonNode reply) {
        exchanges.put(url, FindExchangeResult.failed(FindExchangeResult.KEYS_FAILURE, httpStatus, reply));
        return this;
    }

    public ScriptedExchangeClient withRefreshedExchange(String url, ExchangeKeys keys, Amount wireFee) {
        refreshed.put(url, FindExchangeResult.found(new ExchangeHandle(url, keys), wireFee, true));
        return this;
    }

    public ScriptedExchangeClient withSilentExchange(String url) {
        silent.add(url);
        return this;
    }

    public ScriptedExchangeClient depositReply(EddsaPublicKey coinPub, DepositResult result) {
        depositReplies.put(coinPub, result);
        return this;
    }

    public ScriptedExchangeClient silentDeposit(EddsaPublicKey coinPub) {
        silentDeposits.add(coinPub);
        return this;
    }

    public ScriptedExchangeClient refundReply(EddsaPublicKey coinPub, RefundResult result) {
        refundReplies.put(coinPub, result);
        return this;
    }

    public List<DepositRequest> deposits() {
        return deposits;
    }

    public List<RefundRequest> refunds() {
        return refunds;
    }

    public int findCalls() {
        return findCalls.get();
    }

    /** Exchange URLs in the order they were looked up, refreshes included. */
    public List<String> lookups() {
        return lookups;
    }

    public int refreshCalls() {
        return refreshCalls.get();
    }

    public int cancellations() {
        return cancellations.get();
    }

    public EddsaPublicKey signingKey() {
        return signingKey;
    }

    @Override
    public ExchangeOperation<FindExchangeResult> findExchange(String exchangeUrl, String wireMethod) {
        findCalls.incrementAndGet();
        lookups.add(exchangeUrl);
        return answer(exchangeUrl, exchanges);
    }

    @Override
    public ExchangeOperation<FindExchangeResult> refreshExchange(String exchangeUrl, String wireMethod) {
        refreshCalls.incrementAndGet();
        lookups.add(exchangeUrl);
        return answer(exchangeUrl, refreshed.containsKey(exchangeUrl) ? refreshed : exchanges);
    }

    private ExchangeOperation<FindExchangeResult> answer(String exchangeUrl, Map<String, FindExchangeResult> results) {
        if (silent.contains(exchangeUrl)) {
            return new ExchangeOperation<>(new CompletableFuture<>(), cancellations::incrementAndGet);
        }
        FindExchangeResult result = results.getOrDefault(
            exchangeUrl,
            FindExchangeResult.failed(FindExchangeResult.KEYS_FAILURE, 0, null)
        );
        return ExchangeOperation.completed(result);
    }

    @Override
    public ExchangeOperation<DepositResult> deposit(ExchangeHandle handle, DepositRequest request) {
        deposits.add(request);
        if (silentDeposits.contains(request.coinPub())) {
            return new ExchangeOperation<>(new CompletableFuture<>(), cancellations::incrementAndGet);
        }
        DepositResult result = depositReplies.getOrDefault(
            request.coinPub(),
            new DepositResult(200, 0, "DEPOSIT-SIG", signingKey, MerchantFixtures.MAPPER.createObjectNode().put("status", "DEPOSIT_OK"))
        );
        return ExchangeOperation.completed(result);
    }

    @Override
    public ExchangeOperation<RefundResult> refund(ExchangeHandle handle, RefundRequest request) {
        refunds.add(request);
        RefundResult result = refundReplies.getOrDefault(
            request.coinPub(),
            new RefundResult(200, 0, signingKey, "REFUND-SIG", MerchantFixtures.MAPPER.createObjectNode().put("status", "REFUND_OK"))
        );
        return ExchangeOperation.completed(result);
    }
}
