package io.kassa.core.exchange;

import java.util.Objects;

/**
 * Connection to one exchange whose keys have been downloaded.
 */
public record ExchangeHandle(String baseUrl, ExchangeKeys keys) {

    public ExchangeHandle {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(keys, "keys must not be null");
    }
}
