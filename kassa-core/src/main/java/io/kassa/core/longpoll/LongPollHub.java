package io.kassa.core.longpoll;

import io.kassa.core.amount.Amount;
import io.kassa.core.amount.CurrencyMismatchException;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requests waiting for an order to be paid (or refunded), indexed by {@code H(order_id, merchant_pub)}
 * and by deadline. A single sweeper thread expires waiters whose deadline passed.
 */
public final class LongPollHub implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LongPollHub.class);

    private final Clock clock;
    private final ScheduledExecutorService sweeper;
    private final Map<HashCode, Set<SuspendedConnection>> byKey;
    private final PriorityQueue<SuspendedConnection> byDeadline;
    private final AtomicLong sequence;
    private ScheduledFuture<?> nextSweep;
    private Instant nextSweepAt;
    private boolean closed;

    public LongPollHub(Clock clock) {
        this.clock = clock;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "long-poll-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        this.byKey = new HashMap<>();
        this.byDeadline = new PriorityQueue<>(
            Comparator.comparing(SuspendedConnection::deadline).thenComparingLong(SuspendedConnection::sequence)
        );
        this.sequence = new AtomicLong();
    }

    public static HashCode payKey(String orderId, EddsaPublicKey merchantPub) {
        return HashCode.sha256(orderId.getBytes(StandardCharsets.UTF_8), merchantPub.bytes());
    }

    /**
     * Parks a waiter until {@link #resume} matches it, its timeout elapses or the hub shuts down.
     * {@code onResume} runs exactly once, outside the hub's lock.
     */
    public SuspendedConnection suspend(
        String orderId,
        EddsaPublicKey merchantPub,
        Duration timeout,
        Amount minRefund,
        Consumer<ResumeReason> onResume
    ) {
        SuspendedConnection connection = new SuspendedConnection(
            payKey(orderId, merchantPub),
            clock.instant().plus(timeout),
            minRefund,
            onResume,
            sequence.incrementAndGet()
        );
        boolean rejected;
        synchronized (this) {
            rejected = closed;
            if (!rejected) {
                byKey.computeIfAbsent(connection.key(), ignored -> new LinkedHashSet<>()).add(connection);
                byDeadline.add(connection);
                scheduleSweep();
            }
        }
        if (rejected) {
            connection.resume(ResumeReason.SHUTDOWN);
        } else {
            LOG.debug("Suspended long poller on order {} until {}", orderId, connection.deadline());
        }
        return connection;
    }

    /**
     * Wakes every waiter on the order that is not waiting for a refund, or whose expected refund is
     * below {@code refundAmount}. Returns how many were resumed.
     */
    public int resume(String orderId, EddsaPublicKey merchantPub, Amount refundAmount) {
        HashCode key = payKey(orderId, merchantPub);
        List<SuspendedConnection> ready = new ArrayList<>();
        synchronized (this) {
            Set<SuspendedConnection> bucket = byKey.get(key);
            if (bucket == null) {
                return 0;
            }
            Iterator<SuspendedConnection> it = bucket.iterator();
            while (it.hasNext()) {
                SuspendedConnection connection = it.next();
                if (shouldResume(connection, refundAmount)) {
                    it.remove();
                    byDeadline.remove(connection);
                    ready.add(connection);
                }
            }
            if (bucket.isEmpty()) {
                byKey.remove(key);
            }
        }
        if (!ready.isEmpty()) {
            LOG.info("Resuming {} long poller(s) on order {}", ready.size(), orderId);
        }
        ready.forEach(connection -> connection.resume(ResumeReason.TRIGGERED));
        return ready.size();
    }

    /**
     * Withdraws a waiter without resuming it. Returns false when it was already resumed, in which
     * case its callback has run or is about to run.
     */
    public boolean cancel(SuspendedConnection connection) {
        synchronized (this) {
            Set<SuspendedConnection> bucket = byKey.get(connection.key());
            if (bucket == null || !bucket.remove(connection)) {
                return false;
            }
            if (bucket.isEmpty()) {
                byKey.remove(connection.key());
            }
            byDeadline.remove(connection);
        }
        LOG.debug("Withdrew long poller with deadline {}", connection.deadline());
        return true;
    }

    public synchronized int size() {
        return byDeadline.size();
    }

    /**
     * Resumes every waiter with {@link ResumeReason#SHUTDOWN}; later suspends are refused.
     */
    public void shutdown() {
        List<SuspendedConnection> all;
        synchronized (this) {
            closed = true;
            all = new ArrayList<>(byDeadline);
            byDeadline.clear();
            byKey.clear();
            if (nextSweep != null) {
                nextSweep.cancel(false);
                nextSweep = null;
            }
        }
        if (!all.isEmpty()) {
            LOG.info("Force-resuming {} long poller(s) for shutdown", all.size());
        }
        all.forEach(connection -> connection.resume(ResumeReason.SHUTDOWN));
    }

    @Override
    public void close() {
        shutdown();
        sweeper.shutdownNow();
    }

    private boolean shouldResume(SuspendedConnection connection, Amount refundAmount) {
        if (!connection.awaitingRefund()) {
            return true;
        }
        if (refundAmount == null) {
            return false;
        }
        try {
            return refundAmount.greaterThan(connection.refundExpected());
        } catch (CurrencyMismatchException e) {
            LOG.warn("Ignoring refund notification in {} for poller expecting {}", refundAmount, connection.refundExpected());
            return false;
        }
    }

    private void scheduleSweep() {
        SuspendedConnection head = byDeadline.peek();
        if (head == null) {
            return;
        }
        if (nextSweep != null && nextSweepAt != null && !head.deadline().isBefore(nextSweepAt)) {
            return;
        }
        if (nextSweep != null) {
            nextSweep.cancel(false);
        }
        long delay = Math.max(0, Duration.between(clock.instant(), head.deadline()).toMillis());
        nextSweepAt = head.deadline();
        nextSweep = sweeper.schedule(this::sweep, delay, TimeUnit.MILLISECONDS);
    }

    private void sweep() {
        List<SuspendedConnection> expired = new ArrayList<>();
        synchronized (this) {
            nextSweep = null;
            nextSweepAt = null;
            Instant now = clock.instant();
            while (!byDeadline.isEmpty() && !byDeadline.peek().deadline().isAfter(now)) {
                SuspendedConnection connection = byDeadline.poll();
                Set<SuspendedConnection> bucket = byKey.get(connection.key());
                if (bucket != null) {
                    bucket.remove(connection);
                    if (bucket.isEmpty()) {
                        byKey.remove(connection.key());
                    }
                }
                expired.add(connection);
            }
            if (!closed) {
                scheduleSweep();
            }
        }
        for (SuspendedConnection connection : expired) {
            try {
                connection.resume(ResumeReason.TIMEOUT);
            } catch (RuntimeException e) {
                LOG.error("Long poller failed to resume after timeout", e);
            }
        }
    }
}
