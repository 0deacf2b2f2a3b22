package io.kassa.core.amount;

public class AmountException extends RuntimeException {

    public AmountException(String message) {
        super(message);
    }
}
