package io.kassa.core.exchange;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One in-flight exchange request. Once {@link #cancel()} has returned, callbacks registered
 * through {@link #onComplete} are no longer started.
 */
public final class ExchangeOperation<T> {
    private final CompletableFuture<T> result;
    private final Runnable canceller;
    private final AtomicBoolean cancelled;

    public ExchangeOperation(CompletableFuture<T> result, Runnable canceller) {
        this.result = result;
        this.canceller = canceller;
        this.cancelled = new AtomicBoolean(false);
    }

    public static <T> ExchangeOperation<T> completed(T value) {
        return new ExchangeOperation<>(CompletableFuture.completedFuture(value), () -> {
        });
    }

    public ExchangeOperation<T> onComplete(Executor executor, Consumer<T> callback) {
        result.thenAcceptAsync(value -> {
            if (!cancelled.get()) {
                callback.accept(value);
            }
        }, executor);
        return this;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            canceller.run();
            result.cancel(false);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public CompletableFuture<T> future() {
        return result;
    }
}
