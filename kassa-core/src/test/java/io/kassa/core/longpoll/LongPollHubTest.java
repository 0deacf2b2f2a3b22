package io.kassa.core.longpoll;

import static org.assertj.core.api.Assertions.assertThat;

import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.support.MerchantFixtures;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LongPollHubTest {
    private final LongPollHub hub = new LongPollHub(Clock.systemUTC());
    private final EddsaPublicKey merchant = MerchantFixtures.randomKey();

    @AfterEach
    void tearDown() {
        hub.close();
    }

    @Test
    void shouldResumeOnlyWaitersOfTheSameOrder() {
        List<ResumeReason> first = new CopyOnWriteArrayList<>();
        List<ResumeReason> other = new CopyOnWriteArrayList<>();
        hub.suspend("order-1", merchant, Duration.ofMinutes(1), null, first::add);
        hub.suspend("order-2", merchant, Duration.ofMinutes(1), null, other::add);

        int resumed = hub.resume("order-1", merchant, null);

        assertThat(resumed).isEqualTo(1);
        assertThat(first).containsExactly(ResumeReason.TRIGGERED);
        assertThat(other).isEmpty();
        assertThat(hub.size()).isEqualTo(1);
    }

    @Test
    void shouldKeepRefundWaiterUntilRefundExceedsExpectation() {
        List<ResumeReason> reasons = new CopyOnWriteArrayList<>();
        hub.suspend("order-1", merchant, Duration.ofMinutes(1), Amount.parse("EUR:2"), reasons::add);

        assertThat(hub.resume("order-1", merchant, null)).isZero();
        assertThat(hub.resume("order-1", merchant, Amount.parse("EUR:2"))).isZero();
        assertThat(hub.resume("order-1", merchant, Amount.parse("EUR:2.5"))).isEqualTo(1);

        assertThat(reasons).containsExactly(ResumeReason.TRIGGERED);
    }

    @Test
    void shouldWithdrawWaiterWithoutResumingIt() {
        List<ResumeReason> reasons = new CopyOnWriteArrayList<>();
        SuspendedConnection waiter = hub.suspend("order-1", merchant, Duration.ofMinutes(1), null, reasons::add);

        assertThat(hub.cancel(waiter)).isTrue();
        assertThat(hub.cancel(waiter)).isFalse();
        assertThat(hub.resume("order-1", merchant, null)).isZero();

        assertThat(reasons).isEmpty();
        assertThat(hub.size()).isZero();
    }

    @Test
    void shouldNotWithdrawWaiterThatWasAlreadyResumed() {
        List<ResumeReason> reasons = new CopyOnWriteArrayList<>();
        SuspendedConnection waiter = hub.suspend("order-1", merchant, Duration.ofMinutes(1), null, reasons::add);
        hub.resume("order-1", merchant, null);

        assertThat(hub.cancel(waiter)).isFalse();
        assertThat(reasons).containsExactly(ResumeReason.TRIGGERED);
    }

    @Test
    void shouldTimeOutWaitersInDeadlineOrder() throws Exception {
        CompletableFuture<ResumeReason> early = new CompletableFuture<>();
        CompletableFuture<ResumeReason> late = new CompletableFuture<>();
        hub.suspend("order-1", merchant, Duration.ofMinutes(5), null, late::complete);
        hub.suspend("order-1", merchant, Duration.ofMillis(50), null, early::complete);

        assertThat(early.get(5, TimeUnit.SECONDS)).isEqualTo(ResumeReason.TIMEOUT);
        assertThat(late).isNotDone();
        assertThat(hub.size()).isEqualTo(1);
    }

    @Test
    void shouldReleaseEveryWaiterOnShutdownAndRefuseNewOnes() {
        List<ResumeReason> reasons = new CopyOnWriteArrayList<>();
        hub.suspend("order-1", merchant, Duration.ofMinutes(1), null, reasons::add);
        hub.suspend("order-2", merchant, Duration.ofMinutes(1), Amount.parse("EUR:1"), reasons::add);

        hub.shutdown();
        hub.suspend("order-3", merchant, Duration.ofMinutes(1), null, reasons::add);

        assertThat(reasons).containsExactly(ResumeReason.SHUTDOWN, ResumeReason.SHUTDOWN, ResumeReason.SHUTDOWN);
        assertThat(hub.size()).isZero();
    }

    @Test
    void shouldResumeEachWaiterOnlyOnce() {
        List<ResumeReason> reasons = new CopyOnWriteArrayList<>();
        hub.suspend("order-1", merchant, Duration.ofMinutes(1), null, reasons::add);

        hub.resume("order-1", merchant, null);
        hub.resume("order-1", merchant, null);
        hub.shutdown();

        assertThat(reasons).containsExactly(ResumeReason.TRIGGERED);
    }

    @Test
    void shouldSeparateOrdersOfDifferentMerchants() {
        assertThat(LongPollHub.payKey("order-1", merchant))
            .isNotEqualTo(LongPollHub.payKey("order-1", MerchantFixtures.randomKey()))
            .isEqualTo(LongPollHub.payKey("order-1", merchant));
    }
}
