package io.kassa.core.pay;

import io.kassa.core.amount.Amount;
import io.kassa.core.contract.ContractTerms;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.exchange.ExchangeOperation;
import io.kassa.core.exchange.FindExchangeResult;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.instance.WireMethod;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * State of one {@code /pay} request. All fields are guarded by the context's monitor.
 */
final class PayContext {
    final long id;
    final MerchantInstance instance;
    final CompletableFuture<MerchantReply> reply;

    PayRequest request;
    ContractTerms contract;
    WireMethod wireMethod;

    Amount totalPaid;
    Amount totalFeesPaid;
    Amount totalRefunded;
    int pending;
    int pendingAtCe;
    String currentExchange;
    EddsaPublicKey conflictingCoin;
    int retryCounter;
    final Set<String> refreshedExchanges = new HashSet<>();

    ExchangeOperation<FindExchangeResult> findOperation;
    ScheduledFuture<?> timeout;

    PayContext(long id, MerchantInstance instance) {
        this.id = id;
        this.instance = instance;
        this.reply = new CompletableFuture<>();
    }

    List<PayCoin> coins() {
        return request.coins();
    }

    boolean isDone() {
        return reply.isDone();
    }

    void resetAccumulators() {
        String currency = contract.currency();
        totalPaid = Amount.zero(currency);
        totalFeesPaid = Amount.zero(currency);
        totalRefunded = Amount.zero(currency);
        conflictingCoin = null;
        pending = coins().size();
        for (PayCoin coin : coins()) {
            coin.foundInDb = false;
            coin.refunded = false;
        }
    }

    /**
     * Completes the request once; later calls are ignored. Outstanding exchange calls and the
     * timeout are cancelled.
     */
    boolean complete(MerchantReply result) {
        if (!reply.complete(result)) {
            return false;
        }
        if (timeout != null) {
            timeout.cancel(false);
            timeout = null;
        }
        if (findOperation != null) {
            findOperation.cancel();
            findOperation = null;
        }
        if (request != null) {
            request.coins().forEach(PayCoin::cancelDeposit);
        }
        return true;
    }
}
