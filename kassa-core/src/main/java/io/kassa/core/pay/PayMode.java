package io.kassa.core.pay;

import java.util.Optional;

public enum PayMode {
    PAY("pay"),
    ABORT_REFUND("abort-refund");

    private final String wireName;

    PayMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<PayMode> fromWireName(String name) {
        for (PayMode mode : values()) {
            if (mode.wireName.equals(name)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
