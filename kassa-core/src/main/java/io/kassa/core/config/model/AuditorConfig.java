package io.kassa.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditorConfig(
    String name,
    String url,
    @JsonAlias({"public_key"}) String publicKey
) {
}
