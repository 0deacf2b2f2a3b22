package io.kassa.core.amount;

public final class AmountOverflowException extends AmountException {

    public AmountOverflowException(String message) {
        super(message);
    }
}
