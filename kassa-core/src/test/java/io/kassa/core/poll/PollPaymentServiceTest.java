package io.kassa.core.poll;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.contract.CanonicalJson;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.db.DbTransaction;
import io.kassa.core.db.DepositRecord;
import io.kassa.core.db.SqliteMerchantDb;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantException;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.longpoll.LongPollHub;
import io.kassa.core.support.FlakyMerchantDb;
import io.kassa.core.support.MerchantFixtures;
import io.kassa.core.uri.RequestOrigin;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PollPaymentServiceTest {
    private static final RequestOrigin ORIGIN = RequestOrigin.of("shop.example", false);

    @TempDir
    Path tempDir;

    private final MerchantInstance instance = MerchantFixtures.instance("default");
    private SqliteMerchantDb db;
    private LongPollHub hub;
    private PollPaymentService service;
    private HashCode h;

    @BeforeEach
    void setUp() throws Exception {
        db = new SqliteMerchantDb(tempDir.resolve("merchant.db"));
        hub = new LongPollHub(Clock.systemUTC());
        service = new PollPaymentService(db, hub, Clock.systemUTC());
        ObjectNode terms = MerchantFixtures.order(instance, "order-1", "EUR:10", "EUR:0.10");
        db.insertContractTerms("order-1", instance.publicKey(), Instant.now(), terms);
        h = CanonicalJson.hash(terms);
    }

    @AfterEach
    void tearDown() {
        service.close();
        hub.close();
        db.close();
    }

    @Test
    void shouldReportUnpaidOrderWithPayUriImmediately() throws Exception {
        MerchantReply reply = service.poll(instance, request(Map.of())).get(5, TimeUnit.SECONDS);

        assertThat(reply.status()).isEqualTo(200);
        assertThat(reply.body())
            .containsEntry("paid", false)
            .containsEntry("taler_pay_uri", "taler://pay/shop.example/-/-/order-1?insecure=1")
            .containsEntry("contract_url", "http://shop.example/proposal?instance=default&order_id=order-1");
        assertThat(hub.size()).isZero();
    }

    @Test
    void shouldWakeWaitingPollerWhenOrderGetsPaid() throws Exception {
        CompletableFuture<MerchantReply> pending = service.poll(instance, request(Map.of("timeout", "30")));
        assertThat(pending).isNotDone();
        assertThat(hub.size()).isEqualTo(1);

        markPaid(null);
        hub.resume("order-1", instance.publicKey(), null);

        MerchantReply reply = pending.get(5, TimeUnit.SECONDS);
        assertThat(reply.body()).containsEntry("paid", true).containsEntry("refunded", false);
        assertThat(hub.size()).isZero();
    }

    @Test
    void shouldNotMissPaymentCommittedWhilePollerIsBeingParked() throws Exception {
        FlakyMerchantDb racing = new FlakyMerchantDb(db);
        PollPaymentService racingService = new PollPaymentService(racing, hub, Clock.systemUTC());
        racing.afterNextPaidLookup(() -> {
            try {
                markPaid(null);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            assertThat(hub.resume("order-1", instance.publicKey(), null)).isZero();
        });

        try {
            long started = System.nanoTime();
            MerchantReply reply = racingService.poll(instance, request(Map.of("timeout", "30"))).get(5, TimeUnit.SECONDS);

            assertThat(reply.body()).containsEntry("paid", true);
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(2_000);
            assertThat(hub.size()).isZero();
        } finally {
            racingService.close();
        }
    }

    @Test
    void shouldAnswerUnpaidAfterTimeout() throws Exception {
        CompletableFuture<MerchantReply> pending = service.poll(instance, request(Map.of("timeout", "1")));

        MerchantReply reply = pending.get(5, TimeUnit.SECONDS);

        assertThat(reply.body()).containsEntry("paid", false);
    }

    @Test
    void shouldReportRefundedAmountOfPaidOrder() throws Exception {
        markPaid(null);
        try (DbTransaction tx = db.start("refund")) {
            tx.increaseRefundForContract(h, instance.publicKey(), Amount.parse("EUR:1.5"), "late delivery");
            tx.commit();
        }

        MerchantReply reply = service.poll(instance, request(Map.of())).get(5, TimeUnit.SECONDS);

        assertThat(reply.body())
            .containsEntry("paid", true)
            .containsEntry("refunded", true)
            .containsEntry("refund_amount", "EUR:1.5");
    }

    @Test
    void shouldKeepWaitingUntilRefundExceedsThreshold() throws Exception {
        markPaid(null);

        CompletableFuture<MerchantReply> pending = service.poll(instance, request(Map.of("timeout", "30", "refund", "EUR:1")));
        assertThat(pending).isNotDone();

        try (DbTransaction tx = db.start("refund")) {
            tx.increaseRefundForContract(h, instance.publicKey(), Amount.parse("EUR:2"), "late delivery");
            tx.commit();
        }
        hub.resume("order-1", instance.publicKey(), Amount.parse("EUR:2"));

        MerchantReply reply = pending.get(5, TimeUnit.SECONDS);
        assertThat(reply.body()).containsEntry("refund_amount", "EUR:2");
    }

    @Test
    void shouldPointWalletToOrderAlreadyPaidInSession() throws Exception {
        ObjectNode other = MerchantFixtures.order(instance, "order-0", "EUR:10", "EUR:0.10");
        other.put("fulfillment_url", "https://shop.example/article/order-1");
        db.insertContractTerms("order-0", instance.publicKey(), Instant.now(), other);
        try (DbTransaction tx = db.start("session")) {
            tx.insertSessionInfo("session-1", "https://shop.example/article/order-1", "order-0", instance.publicKey());
            tx.commit();
        }

        MerchantReply reply = service.poll(instance, request(Map.of("session_id", "session-1"))).get(5, TimeUnit.SECONDS);

        assertThat(reply.body())
            .containsEntry("paid", false)
            .containsEntry("already_paid_order_id", "order-0")
            .containsEntry("taler_pay_uri", "taler://pay/shop.example/-/-/order-1/session-1?insecure=1");
    }

    @Test
    void shouldReportPaidForMatchingSession() throws Exception {
        markPaid("session-1");

        MerchantReply reply = service.poll(instance, request(Map.of("session_id", "session-1"))).get(5, TimeUnit.SECONDS);

        assertThat(reply.body()).containsEntry("paid", true);
    }

    @Test
    void shouldRejectUnknownContract() throws Exception {
        Map<String, String> query = new HashMap<>();
        query.put("order_id", "order-2");
        query.put("h_contract", h.toBase32());

        MerchantReply reply = service.poll(instance, PollRequest.fromQuery(query, ORIGIN)).get(5, TimeUnit.SECONDS);

        assertThat(reply.status()).isEqualTo(404);
        assertThat(reply.body()).containsEntry("code", ErrorCode.POLL_PAYMENT_CONTRACT_NOT_FOUND.code());
    }

    @Test
    void shouldDropWaitersOnHubShutdown() throws Exception {
        CompletableFuture<MerchantReply> pending = service.poll(instance, request(Map.of("timeout", "30")));

        hub.shutdown();

        assertThat(pending.get(5, TimeUnit.SECONDS).isDrop()).isTrue();
    }

    @Test
    void shouldValidateQuery() {
        assertThatThrownBy(() -> PollRequest.fromQuery(Map.of("h_contract", h.toBase32()), ORIGIN))
            .isInstanceOfSatisfying(MerchantException.class, e ->
                assertThat(e.reply().body()).containsEntry("code", ErrorCode.PARAMETER_MISSING.code()));
        assertThatThrownBy(() -> PollRequest.fromQuery(Map.of("order_id", "o", "h_contract", "???"), ORIGIN))
            .isInstanceOf(MerchantException.class);
        assertThatThrownBy(() -> PollRequest.fromQuery(
            Map.of("order_id", "o", "h_contract", h.toBase32(), "timeout", "-1"), ORIGIN))
            .isInstanceOf(MerchantException.class);
        assertThatThrownBy(() -> PollRequest.fromQuery(
            Map.of("order_id", "o", "h_contract", h.toBase32(), "refund", "lots"), ORIGIN))
            .isInstanceOf(MerchantException.class);
    }

    @Test
    void shouldParseTimeoutInSeconds() throws Exception {
        PollRequest request = request(Map.of("timeout", "15", "refund", "EUR:0.5"));

        assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(request.minRefund()).isEqualTo(Amount.parse("EUR:0.5"));
    }

    private PollRequest request(Map<String, String> extra) throws MerchantException {
        Map<String, String> query = new HashMap<>(extra);
        query.put("order_id", "order-1");
        query.put("h_contract", h.toBase32());
        return PollRequest.fromQuery(query, ORIGIN);
    }

    private void markPaid(String sessionId) throws Exception {
        db.storeDeposit(new DepositRecord(
            h,
            instance.publicKey(),
            MerchantFixtures.randomKey(),
            MerchantFixtures.EXCHANGE_URL,
            Amount.parse("EUR:10.05"),
            Amount.parse("EUR:0.05"),
            Amount.parse("EUR:0.01"),
            Amount.zero("EUR"),
            MerchantFixtures.randomKey(),
            null
        ));
        try (DbTransaction tx = db.start("pay")) {
            tx.markProposalPaid(h, instance.publicKey());
            if (sessionId != null) {
                tx.insertSessionInfo(sessionId, "https://shop.example/article/order-1", "order-1", instance.publicKey());
            }
            tx.commit();
        }
    }
}
