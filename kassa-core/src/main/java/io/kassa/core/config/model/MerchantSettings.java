package io.kassa.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MerchantSettings(
    String currency,
    int port,
    String host,
    String database,
    @JsonAlias({"pay_timeout_seconds"}) int payTimeoutSeconds,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"force_audit"}) boolean forceAudit,
    @JsonAlias({"http_timeout_seconds"}) int httpTimeoutSeconds
) {

    public static MerchantSettings defaults() {
        return new MerchantSettings("EUR", 9966, "0.0.0.0", "~/.kassa/merchant.db", 30, 5, false, 25);
    }

    public Duration payTimeout() {
        return Duration.ofSeconds(payTimeoutSeconds);
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(httpTimeoutSeconds);
    }

    public MerchantSettings withPort(int newPort) {
        return new MerchantSettings(currency, newPort, host, database, payTimeoutSeconds, maxRetries, forceAudit, httpTimeoutSeconds);
    }

    public MerchantSettings withDatabase(String newDatabase) {
        return new MerchantSettings(currency, port, host, newDatabase, payTimeoutSeconds, maxRetries, forceAudit, httpTimeoutSeconds);
    }
}
