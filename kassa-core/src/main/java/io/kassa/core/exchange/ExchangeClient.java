package io.kassa.core.exchange;

/**
 * Asynchronous access to exchanges. Implementations never throw for remote failures; they
 * complete the operation with a result carrying the HTTP status and error code instead.
 */
public interface ExchangeClient extends AutoCloseable {

    /**
     * Obtains the exchange's keys and, unless {@code wireMethod} is null, its current fee for
     * wiring funds with that method.
     */
    ExchangeOperation<FindExchangeResult> findExchange(String exchangeUrl, String wireMethod);

    /**
     * Like {@link #findExchange} but discards any cached keys first, for callers that found the
     * cached keys lacking something the exchange may have published since.
     */
    default ExchangeOperation<FindExchangeResult> refreshExchange(String exchangeUrl, String wireMethod) {
        return findExchange(exchangeUrl, wireMethod);
    }

    ExchangeOperation<DepositResult> deposit(ExchangeHandle handle, DepositRequest request);

    ExchangeOperation<RefundResult> refund(ExchangeHandle handle, RefundRequest request);

    @Override
    default void close() {
    }
}
