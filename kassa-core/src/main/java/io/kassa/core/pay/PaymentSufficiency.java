package io.kassa.core.pay;

import io.kassa.core.amount.Amount;
import io.kassa.core.contract.ContractTerms;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantReply;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether the coins of a pay request cover the contract once fees and refunds are taken
 * into account. Deposit fees up to {@code max_fee} are borne by the merchant; the excess, plus the
 * amortized share of wire fees above {@code max_wire_fee}, must be paid by the customer.
 */
final class PaymentSufficiency {

    private PaymentSufficiency() {
    }

    static Optional<MerchantReply> check(ContractTerms contract, List<PayCoin> coins, Amount totalRefunded) {
        if (coins.isEmpty()) {
            return Optional.of(MerchantReply.error(ErrorCode.PAY_PAYMENT_INSUFFICIENT, "no coins given"));
        }
        String currency = contract.currency();
        Amount accFee = Amount.zero(currency);
        Amount accAmount = Amount.zero(currency);
        Amount totalWireFee = null;
        Set<String> exchanges = new HashSet<>();
        for (PayCoin coin : coins) {
            if (coin.depositFee.greaterThan(coin.amountWithFee)) {
                return Optional.of(MerchantReply.error(
                    ErrorCode.PAY_FEES_EXCEED_PAYMENT,
                    "deposit fee exceeds coin's contribution",
                    Map.of("coin_pub", coin.coinPub.toBase32())
                ));
            }
            accFee = accFee.add(coin.depositFee);
            accAmount = accAmount.add(coin.amountWithFee);
            if (exchanges.add(coin.exchangeUrl) && coin.wireFee != null) {
                totalWireFee = totalWireFee == null ? coin.wireFee : totalWireFee.add(coin.wireFee);
            }
        }
        if (totalWireFee == null) {
            totalWireFee = Amount.zero(contract.maxWireFee().currency());
        }
        if (!totalWireFee.sameCurrency(contract.maxWireFee())) {
            return Optional.of(MerchantReply.error(
                ErrorCode.PAY_WIRE_FEE_CURRENCY_MISMATCH,
                "exchange wire fee is in " + totalWireFee.currency() + ", contract limit in "
                    + contract.maxWireFee().currency()
            ));
        }
        Amount wireFeeDelta = totalWireFee.subtractOrZero(contract.maxWireFee());
        accFee = accFee.add(wireFeeDelta.divide(contract.wireFeeAmortization()));

        Amount totalNeeded = accFee.subtract(contract.maxFee())
            .map(contract.amount()::add)
            .orElse(contract.amount());
        Amount finalAmount = accAmount.subtractOrZero(totalRefunded);

        if (finalAmount.atLeast(totalNeeded)) {
            return Optional.empty();
        }
        if (accAmount.atLeast(totalNeeded)) {
            return Optional.of(MerchantReply.error(
                ErrorCode.PAY_REFUNDED,
                "contract not paid up due to refunds",
                Map.of("refunded", totalRefunded.toString())
            ));
        }
        if (accAmount.atLeast(contract.amount())) {
            return Optional.of(MerchantReply.error(
                ErrorCode.PAY_PAYMENT_INSUFFICIENT_DUE_TO_FEES,
                "payment insufficient due to fees, " + totalNeeded + " needed"
            ));
        }
        return Optional.of(MerchantReply.error(
            ErrorCode.PAY_PAYMENT_INSUFFICIENT,
            "payment insufficient, " + accAmount + " given but " + totalNeeded + " needed"
        ));
    }
}
