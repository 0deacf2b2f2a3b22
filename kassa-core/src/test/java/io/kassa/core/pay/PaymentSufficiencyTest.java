package io.kassa.core.pay;

import static org.assertj.core.api.Assertions.assertThat;

import io.kassa.core.amount.Amount;
import io.kassa.core.contract.ContractTerms;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.support.MerchantFixtures;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PaymentSufficiencyTest {
    private static final Amount NOTHING = Amount.zero("EUR");

    private final MerchantInstance instance = MerchantFixtures.instance("default");

    @Test
    void shouldAcceptSingleCoinWhoseFeeStaysUnderMaxFee() throws Exception {
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0", 1);

        Optional<MerchantReply> verdict = PaymentSufficiency.check(
            contract,
            List.of(coin(0, "EUR:10.05", "EUR:0.05", "EUR:0", "https://ex1/")),
            NOTHING
        );

        assertThat(verdict).isEmpty();
    }

    @Test
    void shouldChargeCustomerForFeesAboveMaxFee() throws Exception {
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0", 1);

        Optional<MerchantReply> enough = PaymentSufficiency.check(
            contract,
            List.of(
                coin(0, "EUR:5.10", "EUR:0.10", "EUR:0", "https://ex1/"),
                coin(1, "EUR:5.10", "EUR:0.10", "EUR:0", "https://ex1/")
            ),
            NOTHING
        );
        Optional<MerchantReply> shortfall = PaymentSufficiency.check(
            contract,
            List.of(
                coin(0, "EUR:5.04", "EUR:0.10", "EUR:0", "https://ex1/"),
                coin(1, "EUR:5.04", "EUR:0.10", "EUR:0", "https://ex1/")
            ),
            NOTHING
        );

        assertThat(enough).isEmpty();
        assertThat(shortfall).hasValueSatisfying(reply ->
            assertThat(reply.body().get("code")).isEqualTo(ErrorCode.PAY_PAYMENT_INSUFFICIENT_DUE_TO_FEES.code()));
    }

    @Test
    void shouldAmortizeWireFeeAboveLimit() throws Exception {
        // wire fee 0.05 over a 0.01 limit, split across 2 payments, adds 0.02 to the fees
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0.01", 2);

        Optional<MerchantReply> covered = PaymentSufficiency.check(
            contract,
            List.of(coin(0, "EUR:10.02", "EUR:0.10", "EUR:0.05", "https://ex1/")),
            NOTHING
        );
        Optional<MerchantReply> uncovered = PaymentSufficiency.check(
            contract,
            List.of(coin(0, "EUR:10.01", "EUR:0.10", "EUR:0.05", "https://ex1/")),
            NOTHING
        );

        assertThat(covered).isEmpty();
        assertThat(uncovered).hasValueSatisfying(reply ->
            assertThat(reply.body().get("code")).isEqualTo(ErrorCode.PAY_PAYMENT_INSUFFICIENT_DUE_TO_FEES.code()));
    }

    @Test
    void shouldCountWireFeeOncePerExchange() throws Exception {
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0", 1);

        Optional<MerchantReply> verdict = PaymentSufficiency.check(
            contract,
            List.of(
                coin(0, "EUR:5.05", "EUR:0.05", "EUR:0.06", "https://ex1/"),
                coin(1, "EUR:5.00", "EUR:0", "EUR:0.06", "https://ex1/")
            ),
            NOTHING
        );

        assertThat(verdict).isEmpty();
    }

    @Test
    void shouldReportRefundedWhenRefundsEatIntoPayment() throws Exception {
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0", 1);

        Optional<MerchantReply> verdict = PaymentSufficiency.check(
            contract,
            List.of(coin(0, "EUR:10.05", "EUR:0.05", "EUR:0", "https://ex1/")),
            Amount.parse("EUR:1")
        );

        assertThat(verdict).hasValueSatisfying(reply -> {
            assertThat(reply.status()).isEqualTo(ErrorCode.PAY_REFUNDED.httpStatus());
            assertThat(reply.body()).containsEntry("refunded", "EUR:1");
        });
    }

    @Test
    void shouldRejectCoinWhoseFeeExceedsContribution() throws Exception {
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0", 1);

        Optional<MerchantReply> verdict = PaymentSufficiency.check(
            contract,
            List.of(coin(0, "EUR:0.01", "EUR:0.05", "EUR:0", "https://ex1/")),
            NOTHING
        );

        assertThat(verdict).hasValueSatisfying(reply ->
            assertThat(reply.body().get("code")).isEqualTo(ErrorCode.PAY_FEES_EXCEED_PAYMENT.code()));
    }

    @Test
    void shouldReportPlainShortfall() throws Exception {
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0", 1);

        Optional<MerchantReply> verdict = PaymentSufficiency.check(
            contract,
            List.of(coin(0, "EUR:9", "EUR:0.05", "EUR:0", "https://ex1/")),
            NOTHING
        );

        assertThat(verdict).hasValueSatisfying(reply -> {
            assertThat(reply.status()).isEqualTo(400);
            assertThat(reply.body().get("code")).isEqualTo(ErrorCode.PAY_PAYMENT_INSUFFICIENT.code());
        });
    }

    @Test
    void shouldRejectWireFeeInForeignCurrency() throws Exception {
        ContractTerms contract = contract("EUR:10", "EUR:0.10", "EUR:0", 1);

        Optional<MerchantReply> verdict = PaymentSufficiency.check(
            contract,
            List.of(coin(0, "EUR:10.05", "EUR:0.05", "KUDOS:0.01", "https://ex1/")),
            NOTHING
        );

        assertThat(verdict).hasValueSatisfying(reply ->
            assertThat(reply.body().get("code")).isEqualTo(ErrorCode.PAY_WIRE_FEE_CURRENCY_MISMATCH.code()));
    }

    private ContractTerms contract(String amount, String maxFee, String maxWireFee, int amortization) throws Exception {
        return ContractTerms.parse(MerchantFixtures.order(
            instance,
            "order-1",
            amount,
            maxFee,
            maxWireFee,
            amortization,
            Instant.now()
        ));
    }

    private static PayCoin coin(int index, String contribution, String depositFee, String wireFee, String exchangeUrl) {
        PayCoin coin = new PayCoin(
            index,
            MerchantFixtures.randomKey(),
            MerchantFixtures.DENOM_PUB,
            "UB-SIG",
            "COIN-SIG",
            exchangeUrl,
            Amount.parse(contribution)
        );
        coin.depositFee = Amount.parse(depositFee);
        coin.refundFee = Amount.zero("EUR");
        coin.wireFee = Amount.parse(wireFee);
        return coin;
    }
}
