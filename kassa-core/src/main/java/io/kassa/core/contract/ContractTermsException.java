package io.kassa.core.contract;

public final class ContractTermsException extends Exception {

    public ContractTermsException(String message) {
        super(message);
    }

    public ContractTermsException(String message, Throwable cause) {
        super(message, cause);
    }
}
