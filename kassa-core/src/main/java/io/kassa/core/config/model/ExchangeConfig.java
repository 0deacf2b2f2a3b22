package io.kassa.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An exchange the merchant trusts without asking an auditor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExchangeConfig(
    String url,
    @JsonAlias({"master_public_key", "master_key"}) String masterPublicKey
) {
}
