package io.kassa.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountConfig(
    @JsonAlias({"payto_uri"}) String paytoUri,
    String salt,
    Boolean active
) {

    public boolean enabled() {
        return active == null || active;
    }
}
