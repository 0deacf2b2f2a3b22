package io.kassa.core.pay;

import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.exchange.DepositResult;
import io.kassa.core.exchange.ExchangeOperation;

/**
 * One coin offered in a pay request and what this request has learned about it so far.
 * Fees are filled in either from the stored deposit or from the exchange's keys.
 */
final class PayCoin {
    final int index;
    final EddsaPublicKey coinPub;
    final String denomPub;
    final String denomSig;
    final String coinSig;
    final String exchangeUrl;
    final Amount amountWithFee;

    Amount depositFee;
    Amount refundFee;
    Amount wireFee;
    boolean foundInDb;
    boolean refunded;
    ExchangeOperation<DepositResult> depositOperation;

    PayCoin(
        int index,
        EddsaPublicKey coinPub,
        String denomPub,
        String denomSig,
        String coinSig,
        String exchangeUrl,
        Amount amountWithFee
    ) {
        this.index = index;
        this.coinPub = coinPub;
        this.denomPub = denomPub;
        this.denomSig = denomSig;
        this.coinSig = coinSig;
        this.exchangeUrl = exchangeUrl;
        this.amountWithFee = amountWithFee;
    }

    void cancelDeposit() {
        if (depositOperation != null) {
            depositOperation.cancel();
            depositOperation = null;
        }
    }
}
