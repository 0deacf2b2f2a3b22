package io.kassa.core.amount;

public final class AmountFormatException extends AmountException {

    public AmountFormatException(String raw) {
        super("malformed amount: " + raw);
    }
}
