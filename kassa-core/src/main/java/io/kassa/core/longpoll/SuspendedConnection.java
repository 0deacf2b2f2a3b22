package io.kassa.core.longpoll;

import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.HashCode;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A request parked in the {@link LongPollHub}. When {@code minRefund} is set the waiter only wants
 * to hear about refunds strictly larger than it.
 */
public final class SuspendedConnection {
    private final HashCode key;
    private final Instant deadline;
    private final Amount minRefund;
    private final Consumer<ResumeReason> onResume;
    private final long sequence;

    SuspendedConnection(HashCode key, Instant deadline, Amount minRefund, Consumer<ResumeReason> onResume, long sequence) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
        this.minRefund = minRefund;
        this.onResume = Objects.requireNonNull(onResume, "onResume must not be null");
        this.sequence = sequence;
    }

    public HashCode key() {
        return key;
    }

    public Instant deadline() {
        return deadline;
    }

    public boolean awaitingRefund() {
        return minRefund != null;
    }

    public Amount refundExpected() {
        return minRefund;
    }

    long sequence() {
        return sequence;
    }

    void resume(ResumeReason reason) {
        onResume.accept(reason);
    }
}
