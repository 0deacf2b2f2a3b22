package io.kassa.core.db;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.contract.CanonicalJson;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.support.MerchantFixtures;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteMerchantDbTest {

    @TempDir
    Path tempDir;

    private final MerchantInstance instance = MerchantFixtures.instance("default");
    private SqliteMerchantDb db;
    private ObjectNode terms;
    private HashCode h;

    @BeforeEach
    void setUp() throws Exception {
        db = new SqliteMerchantDb(tempDir.resolve("nested/merchant.db"));
        terms = MerchantFixtures.order(instance, "order-1", "EUR:10", "EUR:0.10");
        h = CanonicalJson.hash(terms);
        assertThat(db.insertContractTerms("order-1", instance.publicKey(), Instant.now(), terms))
            .isEqualTo(QueryStatus.ONE_RESULT);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldFindContractTermsByOrderIdAndHash() {
        DbResult<JsonNode> byOrder = db.findContractTerms("order-1", instance.publicKey());
        DbResult<JsonNode> byHash = db.findContractTermsFromHash(h, instance.publicKey());

        assertThat(byOrder.isFound()).isTrue();
        assertThat(CanonicalJson.hash(byOrder.value())).isEqualTo(h);
        assertThat(byHash.isFound()).isTrue();
        assertThat(db.findContractTerms("order-1", MerchantFixtures.randomKey()).status()).isEqualTo(QueryStatus.NO_RESULTS);
        assertThat(db.findPaidContractTermsFromHash(h, instance.publicKey()).isFound()).isFalse();
    }

    @Test
    void shouldIgnoreSecondInsertOfSameOrder() {
        ObjectNode changed = terms.deepCopy().put("summary", "changed");

        QueryStatus status = db.insertContractTerms("order-1", instance.publicKey(), Instant.now(), changed);

        assertThat(status).isEqualTo(QueryStatus.NO_RESULTS);
        assertThat(db.findContractTerms("order-1", instance.publicKey()).value().path("summary").asText())
            .isEqualTo("order order-1");
    }

    @Test
    void shouldStoreDepositIdempotently() {
        EddsaPublicKey coin = MerchantFixtures.randomKey();

        assertThat(db.storeDeposit(deposit(coin, "EUR:5"))).isEqualTo(QueryStatus.ONE_RESULT);
        assertThat(db.storeDeposit(deposit(coin, "EUR:6"))).isEqualTo(QueryStatus.ONE_RESULT);

        List<DepositRecord> deposits = new ArrayList<>();
        assertThat(db.findPayments(h, instance.publicKey(), deposits::add)).isEqualTo(QueryStatus.ONE_RESULT);
        assertThat(deposits).singleElement().satisfies(deposit -> {
            assertThat(deposit.amountWithFee()).isEqualTo(Amount.parse("EUR:5"));
            assertThat(deposit.exchangeProof().path("status").asText()).isEqualTo("DEPOSIT_OK");
        });
    }

    @Test
    void shouldMarkPaidAndRecordSessionOnlyWhenCommitted() throws Exception {
        try (DbTransaction tx = db.start("abandoned")) {
            assertThat(tx.markProposalPaid(h, instance.publicKey())).isEqualTo(QueryStatus.ONE_RESULT);
            tx.insertSessionInfo("s1", "https://shop.example/article/order-1", "order-1", instance.publicKey());
        }
        assertThat(db.findPaidContractTermsFromHash(h, instance.publicKey()).isFound()).isFalse();

        DbTransaction tx = db.start("pay");
        tx.markProposalPaid(h, instance.publicKey());
        tx.insertSessionInfo("s1", "https://shop.example/article/order-1", "order-1", instance.publicKey());
        assertThat(tx.commit()).isEqualTo(QueryStatus.NO_RESULTS);
        assertThat(tx.isOpen()).isFalse();

        assertThat(db.findPaidContractTermsFromHash(h, instance.publicKey()).isFound()).isTrue();
        assertThat(db.findSessionInfo("s1", "https://shop.example/article/order-1", instance.publicKey()).value())
            .isEqualTo("order-1");
        assertThat(db.findSessionInfo("s2", "https://shop.example/article/order-1", instance.publicKey()).isFound())
            .isFalse();
    }

    @Test
    void shouldSpreadRefundIncreaseOverCoinsInDepositOrder() throws Exception {
        EddsaPublicKey first = MerchantFixtures.randomKey();
        EddsaPublicKey second = MerchantFixtures.randomKey();
        db.storeDeposit(deposit(first, "EUR:5"));
        db.storeDeposit(deposit(second, "EUR:5"));

        assertThat(increase("EUR:3")).isEqualTo(QueryStatus.ONE_RESULT);
        assertThat(increase("EUR:7")).isEqualTo(QueryStatus.ONE_RESULT);

        List<RefundRecord> refunds = refunds();
        assertThat(refunds).hasSize(3);
        assertThat(refunds.get(0).coinPub()).isEqualTo(first);
        assertThat(refunds.get(0).refundAmount()).isEqualTo(Amount.parse("EUR:3"));
        assertThat(refunds.get(1).coinPub()).isEqualTo(first);
        assertThat(refunds.get(1).refundAmount()).isEqualTo(Amount.parse("EUR:2"));
        assertThat(refunds.get(1).rtransactionId()).isEqualTo(refunds.get(0).rtransactionId() + 1);
        assertThat(refunds.get(2).coinPub()).isEqualTo(second);
        assertThat(refunds.get(2).refundAmount()).isEqualTo(Amount.parse("EUR:2"));
        assertThat(refunds.get(2).reason()).isEqualTo("broken item");
    }

    @Test
    void shouldTreatLowerOrEqualRefundAsNoOp() throws Exception {
        db.storeDeposit(deposit(MerchantFixtures.randomKey(), "EUR:5"));
        increase("EUR:3");

        assertThat(increase("EUR:3")).isEqualTo(QueryStatus.ONE_RESULT);
        assertThat(increase("EUR:1")).isEqualTo(QueryStatus.ONE_RESULT);
        assertThat(refunds()).hasSize(1);
    }

    @Test
    void shouldRefuseRefundAbovePaidTotal() throws Exception {
        db.storeDeposit(deposit(MerchantFixtures.randomKey(), "EUR:5"));

        assertThat(increase("EUR:5.01")).isEqualTo(QueryStatus.NO_RESULTS);
        assertThat(refunds()).isEmpty();
    }

    @Test
    void shouldKeepFirstRefundProof() {
        EddsaPublicKey coin = MerchantFixtures.randomKey();
        EddsaPublicKey exchangePub = MerchantFixtures.randomKey();

        assertThat(db.putRefundProof(h, instance.publicKey(), coin, 1, new RefundProof(exchangePub, "SIG-1")))
            .isEqualTo(QueryStatus.ONE_RESULT);
        assertThat(db.putRefundProof(h, instance.publicKey(), coin, 1, new RefundProof(exchangePub, "SIG-2")))
            .isEqualTo(QueryStatus.NO_RESULTS);

        assertThat(db.getRefundProof(h, instance.publicKey(), coin, 1).value())
            .isEqualTo(new RefundProof(exchangePub, "SIG-1"));
        assertThat(db.getRefundProof(h, instance.publicKey(), coin, 2).isFound()).isFalse();
    }

    @Test
    void shouldRollBackTransactionLeftOpenByPreflight() throws Exception {
        DbTransaction tx = db.start("leaked");
        tx.markProposalPaid(h, instance.publicKey());

        db.preflight();

        assertThat(tx.isOpen()).isFalse();
        assertThat(db.findPaidContractTermsFromHash(h, instance.publicKey()).isFound()).isFalse();
    }

    @Test
    void shouldDropDataOnReset() throws Exception {
        db.reset();

        assertThat(db.findContractTerms("order-1", instance.publicKey()).isFound()).isFalse();
        assertThat(db.insertContractTerms("order-1", instance.publicKey(), Instant.now(), terms))
            .isEqualTo(QueryStatus.ONE_RESULT);
    }

    private QueryStatus increase(String amount) throws Exception {
        try (DbTransaction tx = db.start("increase")) {
            QueryStatus status = tx.increaseRefundForContract(h, instance.publicKey(), Amount.parse(amount), "broken item");
            assertThat(tx.commit()).isEqualTo(QueryStatus.NO_RESULTS);
            return status;
        }
    }

    private List<RefundRecord> refunds() {
        List<RefundRecord> refunds = new ArrayList<>();
        db.getRefundsFromContractTermsHash(instance.publicKey(), h, refunds::add);
        return refunds;
    }

    private DepositRecord deposit(EddsaPublicKey coin, String amount) {
        return new DepositRecord(
            h,
            instance.publicKey(),
            coin,
            MerchantFixtures.EXCHANGE_URL,
            Amount.parse(amount),
            Amount.parse("EUR:0.05"),
            Amount.parse("EUR:0.01"),
            Amount.zero("EUR"),
            MerchantFixtures.randomKey(),
            MerchantFixtures.MAPPER.createObjectNode().put("status", "DEPOSIT_OK")
        );
    }
}
