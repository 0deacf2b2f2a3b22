package io.kassa.core.amount;

public final class CurrencyMismatchException extends AmountException {

    public CurrencyMismatchException(String left, String right) {
        super("currency mismatch: " + left + " vs " + right);
    }
}
