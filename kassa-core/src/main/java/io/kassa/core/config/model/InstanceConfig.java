package io.kassa.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InstanceConfig(
    String id,
    @JsonAlias({"private_key"}) String privateKey,
    List<AccountConfig> accounts
) {

    public InstanceConfig {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }
}
